package com.autonomous.dashboard.gateway;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

// Callbacks from a superseded connection are never delivered
public interface TransportSession {

    CompletableFuture<Void> connect(URI uri, TransportListener listener);

    void send(String text) throws IOException;

    void close(int code, String reason);

    boolean isOpen();
}
