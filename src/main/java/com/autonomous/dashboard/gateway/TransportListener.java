package com.autonomous.dashboard.gateway;

public interface TransportListener {

    void onMessage(String text);

    void onClose(int code, String reason);

    void onError(Throwable error);
}
