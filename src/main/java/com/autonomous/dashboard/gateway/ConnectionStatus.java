package com.autonomous.dashboard.gateway;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConnectionStatus {
    ConnectionState state;
    Integer protocol;
    Long tickIntervalMs;
    Long maxPayload;
    int reconnectAttempts;
    boolean reconnectExhausted;
    String lastError;

    public boolean isConnected() {
        return state == ConnectionState.AUTHENTICATED;
    }
}
