package com.autonomous.dashboard.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

@Slf4j
public class WebSocketTransportSession implements TransportSession {

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final WebSocketClient client;
    private final int bufferSizeLimit;

    private volatile Handler current;

    public WebSocketTransportSession(WebSocketClient client, int bufferSizeLimit) {
        this.client = client;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public CompletableFuture<Void> connect(URI uri, TransportListener listener) {
        Handler handler = new Handler(listener);
        current = handler;
        return client.execute(handler, new WebSocketHttpHeaders(), uri)
            .thenApply(session -> null);
    }

    @Override
    public void send(String text) throws IOException {
        Handler handler = current;
        WebSocketSession session = handler != null ? handler.session : null;
        if (session == null || !session.isOpen()) {
            throw new IOException("WebSocket is not open");
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(int code, String reason) {
        Handler handler = current;
        WebSocketSession session = handler != null ? handler.session : null;
        if (session == null) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("Failed to close WebSocket cleanly: {}", e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        Handler handler = current;
        return handler != null && handler.session != null && handler.session.isOpen();
    }

    private final class Handler extends TextWebSocketHandler {

        private final TransportListener listener;
        private volatile WebSocketSession session;

        private Handler(TransportListener listener) {
            this.listener = listener;
        }

        private boolean isCurrent() {
            return current == this;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession raw) {
            session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, bufferSizeLimit);
        }

        @Override
        protected void handleTextMessage(WebSocketSession raw, TextMessage message) {
            if (isCurrent()) {
                listener.onMessage(message.getPayload());
            }
        }

        @Override
        public void handleTransportError(WebSocketSession raw, Throwable exception) {
            if (isCurrent()) {
                listener.onError(exception);
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession raw, CloseStatus status) {
            if (isCurrent()) {
                listener.onClose(status.getCode(), status.getReason() != null ? status.getReason() : "Connection closed");
            }
        }
    }
}
