package com.autonomous.dashboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChannelStatus {
    ACTIVE,
    INACTIVE,
    PENDING,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ChannelStatus fromWire(String value) {
        return ChannelStatus.valueOf(value.toUpperCase());
    }
}
