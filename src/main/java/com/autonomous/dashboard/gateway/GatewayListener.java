package com.autonomous.dashboard.gateway;

import com.autonomous.dashboard.gateway.protocol.EventFrame;
import com.autonomous.dashboard.gateway.protocol.HelloOk;

// Callbacks run on the thread that observed the change and must not block
public interface GatewayListener {

    default void onAuthenticated(HelloOk hello) {
    }

    default void onDisconnected(String reason) {
    }

    default void onReconnecting(int attempt, long delayMs) {
    }

    default void onReconnectExhausted(int attempts) {
    }

    default void onEvent(EventFrame event) {
    }
}
