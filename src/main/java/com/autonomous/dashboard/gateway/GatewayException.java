package com.autonomous.dashboard.gateway;

import com.autonomous.dashboard.gateway.protocol.ErrorShape;
import lombok.Getter;

@Getter
public class GatewayException extends RuntimeException {

    public enum Kind {
        CONNECTION_TIMEOUT,
        PROTOCOL_MISMATCH,
        AUTH_REJECTED,
        NOT_CONNECTED,
        REQUEST_TIMEOUT,
        REQUEST_FAILED,
        CLIENT_DISCONNECTED,
        CONNECTION_LOST,
        RECONNECT_EXHAUSTED,
        CONFIG_HASH_CONFLICT
    }

    private final Kind kind;
    private final String method;
    private final ErrorShape remoteError;

    public GatewayException(Kind kind, String message) {
        this(kind, null, message, null, null);
    }

    public GatewayException(Kind kind, String method, String message, ErrorShape remoteError, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.method = method;
        this.remoteError = remoteError;
    }

    public static GatewayException requestTimeout(String method) {
        return new GatewayException(Kind.REQUEST_TIMEOUT, method, "Request timeout: " + method, null, null);
    }

    public static GatewayException remote(String method, ErrorShape error) {
        String message = error != null && error.getMessage() != null ? error.getMessage() : "Request failed";
        return new GatewayException(Kind.REQUEST_FAILED, method, message, error, null);
    }

    public boolean isTimeout() {
        return kind == Kind.CONNECTION_TIMEOUT || kind == Kind.REQUEST_TIMEOUT;
    }
}
