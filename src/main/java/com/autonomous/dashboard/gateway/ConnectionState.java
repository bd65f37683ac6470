package com.autonomous.dashboard.gateway;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,        // socket open, handshake not finished
    AUTHENTICATED
}
