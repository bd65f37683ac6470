package com.autonomous.dashboard.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory socket. Records every frame the client sends and answers the
 * {@code connect} handshake according to {@link #handshake}.
 */
class FakeTransportSession implements TransportSession {

    enum Handshake { HELLO, EMPTY_HELLO, REJECT_AUTH, REJECT_PROTOCOL, WRONG_PROTOCOL, SILENT }

    private final ObjectMapper mapper = GatewayJson.newObjectMapper();
    private final List<JsonNode> sent = new CopyOnWriteArrayList<>();

    volatile Handshake handshake = Handshake.HELLO;
    volatile boolean refuseConnections;
    volatile int connectCount;
    volatile int closeCount;

    private volatile TransportListener listener;
    private volatile boolean open;

    @Override
    public CompletableFuture<Void> connect(URI uri, TransportListener listener) {
        connectCount++;
        if (refuseConnections) {
            return CompletableFuture.failedFuture(new IOException("Connection refused"));
        }
        this.listener = listener;
        this.open = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void send(String text) throws IOException {
        if (!open) {
            throw new IOException("WebSocket is not open");
        }
        JsonNode frame = mapper.readTree(text);
        sent.add(frame);
        if ("connect".equals(frame.path("method").asText())) {
            answerHandshake(frame.path("id").asText());
        }
    }

    @Override
    public void close(int code, String reason) {
        closeCount++;
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    private void answerHandshake(String id) {
        switch (handshake) {
            case HELLO -> respond(id, hello(3));
            case EMPTY_HELLO -> respond(id, "null");
            case WRONG_PROTOCOL -> respond(id, hello(2));
            case REJECT_AUTH -> respondError(id, "UNAUTHORIZED", "invalid token");
            case REJECT_PROTOCOL -> respondError(id, "PROTOCOL_MISMATCH", "protocol 3 not supported");
            case SILENT -> { }
        }
    }

    static String hello(int protocol) {
        return "{\"type\":\"hello-ok\",\"protocol\":" + protocol
            + ",\"policy\":{\"tickIntervalMs\":15000,\"maxPayload\":1048576}}";
    }

    // ============================================
    // Server side
    // ============================================

    void receive(String json) {
        listener.onMessage(json);
    }

    void respond(String id, String payloadJson) {
        receive("{\"type\":\"res\",\"id\":\"" + id + "\",\"ok\":true,\"payload\":" + payloadJson + "}");
    }

    void respondError(String id, String code, String message) {
        receive("{\"type\":\"res\",\"id\":\"" + id + "\",\"ok\":false,\"error\":{\"code\":\"" + code
            + "\",\"message\":\"" + message + "\"}}");
    }

    void emit(String event, String payloadJson) {
        receive("{\"type\":\"event\",\"event\":\"" + event + "\",\"payload\":" + payloadJson + "}");
    }

    void drop() {
        open = false;
        listener.onClose(1006, "Abnormal closure");
    }

    // ============================================
    // Inspection
    // ============================================

    List<JsonNode> requests(String method) {
        return sent.stream()
            .filter(frame -> method.equals(frame.path("method").asText()))
            .collect(Collectors.toList());
    }

    JsonNode lastRequest(String method) {
        List<JsonNode> matching = requests(method);
        if (matching.isEmpty()) {
            throw new AssertionError("No " + method + " request was sent");
        }
        return matching.get(matching.size() - 1);
    }

    String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
