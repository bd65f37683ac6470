package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RequestFrame.class, name = "req"),
    @JsonSubTypes.Type(value = ResponseFrame.class, name = "res"),
    @JsonSubTypes.Type(value = EventFrame.class, name = "event")
})
public abstract class GatewayFrame {
}
