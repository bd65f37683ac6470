package com.autonomous.dashboard.gateway;

import com.autonomous.dashboard.config.GatewayProperties;
import com.autonomous.dashboard.gateway.protocol.AgentRun;
import com.autonomous.dashboard.gateway.protocol.AgentRunRequest;
import com.autonomous.dashboard.gateway.protocol.ClientInfo;
import com.autonomous.dashboard.gateway.protocol.ConfigSnapshot;
import com.autonomous.dashboard.gateway.protocol.ConnectParams;
import com.autonomous.dashboard.gateway.protocol.EventFrame;
import com.autonomous.dashboard.gateway.protocol.GatewayFrame;
import com.autonomous.dashboard.gateway.protocol.HealthStatus;
import com.autonomous.dashboard.gateway.protocol.HelloOk;
import com.autonomous.dashboard.gateway.protocol.PresenceEntry;
import com.autonomous.dashboard.gateway.protocol.RequestFrame;
import com.autonomous.dashboard.gateway.protocol.ResponseFrame;
import com.autonomous.dashboard.gateway.protocol.SendMessageRequest;
import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.model.RemoteGroup;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Client for the Clawdbot gateway: one authenticated socket per instance, with
 * correlated request/response calls, event fan-out and backoff reconnection.
 *
 * <p>Sends never block. {@link #connect()} and {@link #request(String, JsonNode)} return
 * futures that always reach exactly one terminal outcome: a response, a remote error,
 * a timeout, or a disconnect. The typed operations further down ({@link #health()},
 * {@link #listGroups()}, ...) block the calling thread on those futures.
 */
@Slf4j
public class GatewayClient {

    public static final int PROTOCOL_VERSION = 3;
    public static final String WILDCARD_GROUP = "*";

    private static final Set<String> PROTOCOL_ERROR_CODES = Set.of("PROTOCOL_MISMATCH", "UNSUPPORTED_PROTOCOL");
    private static final Set<String> HASH_CONFLICT_CODES =
        Set.of("CONFIG_HASH_MISMATCH", "HASH_MISMATCH", "STALE_BASE_HASH", "CONFLICT");

    private static final int CLOSE_NORMAL = 1000;

    private final GatewayProperties properties;
    private final TransportSession transport;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper mapper;

    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final AtomicLong requestCounter = new AtomicLong();
    private final List<GatewayListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, List<Consumer<EventFrame>>> subscribers = new ConcurrentHashMap<>();

    private final Object stateLock = new Object();

    // guarded by stateLock
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private HelloOk hello;
    private String lastError;
    private int reconnectAttempts;
    private boolean reconnectExhausted;
    private boolean autoReconnect;
    private boolean closedByClient;
    private CompletableFuture<HelloOk> connectFuture;
    private ScheduledFuture<?> reconnectTimer;

    public GatewayClient(GatewayProperties properties, TransportSession transport,
                         ScheduledExecutorService scheduler, ObjectMapper mapper) {
        this.properties = properties;
        this.transport = transport;
        this.scheduler = scheduler;
        this.mapper = mapper;
        this.autoReconnect = properties.isAutoReconnect();
    }

    // ============================================
    // Connection management
    // ============================================

    public CompletableFuture<HelloOk> connect() {
        ScheduledFuture<?> staleTimer;
        CompletableFuture<HelloOk> attempt;
        synchronized (stateLock) {
            if (state == ConnectionState.AUTHENTICATED && hello != null) {
                return CompletableFuture.completedFuture(hello);
            }
            if (connectFuture != null && !connectFuture.isDone()) {
                return connectFuture;
            }
            autoReconnect = properties.isAutoReconnect();
            closedByClient = false;
            if (reconnectExhausted) {
                reconnectExhausted = false;
                reconnectAttempts = 0;
            }
            staleTimer = reconnectTimer;
            reconnectTimer = null;
            attempt = beginAttempt();
        }
        if (staleTimer != null) {
            staleTimer.cancel(false);
        }
        openTransport(attempt);
        return attempt;
    }

    /**
     * Blocks until the client is authenticated, connecting first if needed.
     */
    public HelloOk ensureConnected() {
        synchronized (stateLock) {
            if (state == ConnectionState.AUTHENTICATED && hello != null) {
                return hello;
            }
        }
        return await(connect());
    }

    public void disconnect() {
        ScheduledFuture<?> timer;
        CompletableFuture<HelloOk> inFlight;
        synchronized (stateLock) {
            autoReconnect = false;
            closedByClient = true;
            timer = reconnectTimer;
            reconnectTimer = null;
            inFlight = connectFuture;
            connectFuture = null;
            state = ConnectionState.DISCONNECTED;
            hello = null;
        }
        log.info("Disconnecting from Clawdbot gateway");

        if (timer != null) {
            timer.cancel(false);
        }
        transport.close(CLOSE_NORMAL, "Client disconnect");

        GatewayException disconnected = new GatewayException(GatewayException.Kind.CLIENT_DISCONNECTED, "Client disconnected");
        failAllPending(disconnected);
        if (inFlight != null) {
            inFlight.completeExceptionally(disconnected);
        }
    }

    public ConnectionStatus getStatus() {
        synchronized (stateLock) {
            return ConnectionStatus.builder()
                .state(state)
                .protocol(hello != null ? hello.getProtocol() : null)
                .tickIntervalMs(hello != null && hello.getPolicy() != null ? hello.getPolicy().getTickIntervalMs() : null)
                .maxPayload(hello != null && hello.getPolicy() != null ? hello.getPolicy().getMaxPayload() : null)
                .reconnectAttempts(reconnectAttempts)
                .reconnectExhausted(reconnectExhausted)
                .lastError(lastError)
                .build();
        }
    }

    public boolean isConnected() {
        synchronized (stateLock) {
            return state == ConnectionState.AUTHENTICATED;
        }
    }

    public int pendingRequestCount() {
        return pending.size();
    }

    static long backoffDelay(long baseDelayMs, int attempt) {
        return baseDelayMs * (1L << (attempt - 1));
    }

    // ============================================
    // Requests
    // ============================================

    /**
     * Issues one correlated call. Fails fast with NOT_CONNECTED unless the handshake has completed,
     * or RECONNECT_EXHAUSTED once automatic reconnection has given up.
     */
    public CompletableFuture<JsonNode> request(String method, JsonNode params) {
        synchronized (stateLock) {
            if (state != ConnectionState.AUTHENTICATED) {
                GatewayException.Kind kind = reconnectExhausted
                    ? GatewayException.Kind.RECONNECT_EXHAUSTED
                    : GatewayException.Kind.NOT_CONNECTED;
                String message = reconnectExhausted ? "Reconnection attempts exhausted" : "Not connected";
                return CompletableFuture.failedFuture(new GatewayException(kind, method, message, null, null));
            }
        }
        return sendRequest(method, params, properties.getRequestTimeout().toMillis(), true);
    }

    private CompletableFuture<JsonNode> sendRequest(String method, JsonNode params, long timeoutMs,
                                                    boolean requireAuthenticated) {
        String id = properties.getClientId() + "-" + requestCounter.incrementAndGet();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        PendingRequest entry = new PendingRequest(method, future);
        if (pending.putIfAbsent(id, entry) != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Duplicate request id " + id));
        }

        // A disconnect between the caller's state check and the registration above missed this entry.
        if (requireAuthenticated) {
            GatewayException closed = null;
            synchronized (stateLock) {
                if (state != ConnectionState.AUTHENTICATED) {
                    closed = closedByClient
                        ? new GatewayException(GatewayException.Kind.CLIENT_DISCONNECTED, method, "Client disconnected", null, null)
                        : new GatewayException(GatewayException.Kind.CONNECTION_LOST, method, "Connection closed", null, null);
                }
            }
            if (closed != null) {
                PendingRequest abandoned = pending.remove(id);
                if (abandoned != null) {
                    abandoned.future.completeExceptionally(closed);
                }
                return future;
            }
        }

        ScheduledFuture<?> deadline = scheduler.schedule(() -> {
            PendingRequest expired = pending.remove(id);
            if (expired != null) {
                log.warn("Request timeout: method={} id={} timeoutMs={}", method, id, timeoutMs);
                expired.future.completeExceptionally(GatewayException.requestTimeout(method));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        future.whenComplete((result, error) -> deadline.cancel(false));

        log.trace("Sending request: method={} id={}", method, id);
        try {
            transport.send(mapper.writeValueAsString(new RequestFrame(id, method, params)));
        } catch (IOException e) {
            PendingRequest unsent = pending.remove(id);
            if (unsent != null) {
                unsent.future.completeExceptionally(new GatewayException(GatewayException.Kind.NOT_CONNECTED, method,
                    "Failed to send " + method + ": " + e.getMessage(), null, e));
            }
        }
        return future;
    }

    private void failAllPending(GatewayException error) {
        for (String id : new ArrayList<>(pending.keySet())) {
            PendingRequest entry = pending.remove(id);
            if (entry != null) {
                entry.future.completeExceptionally(error);
            }
        }
    }

    // ============================================
    // Events
    // ============================================

    public void addListener(GatewayListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GatewayListener listener) {
        listeners.remove(listener);
    }

    public EventSubscription subscribe(String eventName, Consumer<EventFrame> handler) {
        subscribers.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(handler);
        return () -> {
            List<Consumer<EventFrame>> handlers = subscribers.get(eventName);
            if (handlers != null) {
                handlers.remove(handler);
            }
        };
    }

    private void dispatchEvent(EventFrame event) {
        log.debug("Received event: {}", event.getEvent());
        for (GatewayListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed for event {}", event.getEvent(), e);
            }
        }
        List<Consumer<EventFrame>> handlers = subscribers.getOrDefault(event.getEvent(), Collections.emptyList());
        for (Consumer<EventFrame> handler : handlers) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                log.error("Event handler failed for event {}", event.getEvent(), e);
            }
        }
    }

    private void notifyListeners(Consumer<GatewayListener> callback) {
        for (GatewayListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.error("Gateway listener failed", e);
            }
        }
    }

    // ============================================
    // Gateway methods
    // ============================================

    public HealthStatus health() {
        return read(call("health", mapper.createObjectNode()), HealthStatus.class, "health");
    }

    public JsonNode status() {
        return call("status", mapper.createObjectNode());
    }

    public ConfigSnapshot fetchConfig() {
        return read(call("config.get", mapper.createObjectNode()), ConfigSnapshot.class, "config.get");
    }

    /**
     * Groups listed under {@code config.channels.<channelKey>.groups}, skipping the wildcard entry.
     */
    public List<RemoteGroup> listGroups() {
        log.debug("Fetching groups");
        List<RemoteGroup> result = groupsFrom(fetchConfig());
        log.debug("Found {} groups", result.size());
        return result;
    }

    public List<RemoteGroup> groupsFrom(ConfigSnapshot snapshot) {
        JsonNode groups = groupsNode(snapshot);
        List<RemoteGroup> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = groups.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (WILDCARD_GROUP.equals(entry.getKey())) {
                continue;
            }
            JsonNode settings = entry.getValue();
            result.add(RemoteGroup.builder()
                .id(entry.getKey())
                .name(settings.path("name").asText(entry.getKey()))
                .description(settings.hasNonNull("description") ? settings.get("description").asText() : null)
                .build());
        }
        return result;
    }

    public Optional<GroupConfig> getGroupConfig(String groupId) {
        return groupConfigFrom(fetchConfig(), groupId);
    }

    public Optional<GroupConfig> groupConfigFrom(ConfigSnapshot snapshot, String groupId) {
        ObjectNode merged = mergeGroupConfig(groupsNode(snapshot), groupId);
        if (merged == null) {
            return Optional.empty();
        }
        return Optional.of(read(merged, GroupConfig.class, "config.get"));
    }

    /**
     * Flat merge of the wildcard entry and the group's own entry: each top-level key of the
     * group entry replaces the wildcard's, nested objects included. Null when neither exists.
     */
    ObjectNode mergeGroupConfig(JsonNode groups, String groupId) {
        JsonNode wildcard = groups.get(WILDCARD_GROUP);
        JsonNode specific = groups.get(groupId);
        boolean hasWildcard = wildcard != null && wildcard.isObject();
        boolean hasSpecific = specific != null && specific.isObject();
        if (!hasWildcard && !hasSpecific) {
            return null;
        }
        ObjectNode merged = mapper.createObjectNode();
        if (hasWildcard) {
            merged.setAll((ObjectNode) wildcard);
        }
        if (hasSpecific) {
            merged.setAll((ObjectNode) specific);
        }
        return merged;
    }

    public void updateGroupConfig(String groupId, GroupConfig config) {
        patchGroupConfig(groupId, config, fetchConfig().getHash());
    }

    /**
     * Submits a patch touching only this group's entry. The gateway applies it only if its
     * config still has {@code baseHash}; otherwise this fails with CONFIG_HASH_CONFLICT and
     * nothing is retried or merged.
     */
    public void patchGroupConfig(String groupId, GroupConfig config, String baseHash) {
        patchGroupEntry(groupId, mapper.valueToTree(config), baseHash);
    }

    /**
     * Like {@link #patchGroupConfig} for a partial entry: keys absent from {@code entry} keep
     * their current value on the gateway.
     */
    public void patchGroupEntry(String groupId, ObjectNode entry, String baseHash) {
        log.info("Updating group config: groupId={}", groupId);
        ObjectNode patch = mapper.createObjectNode();
        patch.putObject("channels")
            .putObject(properties.getChannelKey())
            .putObject("groups")
            .set(groupId, entry);

        ObjectNode params = mapper.createObjectNode();
        params.put("raw", toJson(patch));
        params.put("baseHash", baseHash);
        try {
            call("config.patch", params);
        } catch (GatewayException e) {
            if (isHashConflict(e)) {
                throw new GatewayException(GatewayException.Kind.CONFIG_HASH_CONFLICT, "config.patch",
                    "Gateway config changed since hash " + baseHash, e.getRemoteError(), e);
            }
            throw e;
        }
        log.info("Group config updated: groupId={}", groupId);
    }

    public String sendMessage(String target, String message, String quotedMessageId) {
        return sendMessage(SendMessageRequest.builder()
            .target(target)
            .message(message)
            .quotedMessageId(quotedMessageId)
            .build());
    }

    public String sendMessage(SendMessageRequest sendRequest) {
        log.debug("Sending message to {}", sendRequest.getTarget());
        JsonNode payload = call("send", mapper.valueToTree(sendRequest));
        String messageId = payload.path("messageId").asText(null);
        log.debug("Message sent: target={} messageId={}", sendRequest.getTarget(), messageId);
        return messageId;
    }

    public AgentRun runAgent(AgentRunRequest runRequest) {
        log.debug("Running agent for {}", runRequest.getTo());
        AgentRun run = read(call("agent", mapper.valueToTree(runRequest)), AgentRun.class, "agent");
        log.debug("Agent run started: runId={} status={}", run.getRunId(), run.getStatus());
        return run;
    }

    public List<PresenceEntry> presence() {
        JsonNode entries = call("system-presence", mapper.createObjectNode()).path("entries");
        if (!entries.isArray()) {
            return List.of();
        }
        return read(entries, new TypeReference<List<PresenceEntry>>() {}, "system-presence");
    }

    private JsonNode call(String method, JsonNode params) {
        ensureConnected();
        return await(request(method, params));
    }

    private JsonNode groupsNode(ConfigSnapshot snapshot) {
        if (snapshot == null || snapshot.getConfig() == null) {
            return mapper.createObjectNode();
        }
        JsonNode groups = snapshot.getConfig().path("channels").path(properties.getChannelKey()).path("groups");
        return groups.isObject() ? groups : mapper.createObjectNode();
    }

    private static boolean isHashConflict(GatewayException e) {
        if (e.getKind() != GatewayException.Kind.REQUEST_FAILED || e.getRemoteError() == null) {
            return false;
        }
        String code = e.getRemoteError().getCode();
        String message = e.getRemoteError().getMessage();
        return (code != null && HASH_CONFLICT_CODES.contains(code))
            || (message != null && message.toLowerCase().contains("hash"));
    }

    // ============================================
    // Handshake and reconnection
    // ============================================

    private CompletableFuture<HelloOk> beginAttempt() {
        CompletableFuture<HelloOk> attempt = new CompletableFuture<>();
        connectFuture = attempt;
        state = ConnectionState.CONNECTING;
        return attempt;
    }

    private void openTransport(CompletableFuture<HelloOk> attempt) {
        long timeoutMs = properties.getConnectTimeout().toMillis();
        log.info("Connecting to Clawdbot gateway {} as {}", properties.getUrl(), properties.getClientId());

        ScheduledFuture<?> timeout = scheduler.schedule(() -> {
            GatewayException timedOut = new GatewayException(GatewayException.Kind.CONNECTION_TIMEOUT,
                "Connection timeout after " + timeoutMs + "ms");
            if (attempt.completeExceptionally(timedOut)) {
                log.error("Connection timeout: url={} timeoutMs={}", properties.getUrl(), timeoutMs);
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        attempt.whenComplete((result, error) -> {
            timeout.cancel(false);
            onAttemptSettled(attempt, result, error);
        });

        CompletableFuture<Void> opened;
        try {
            opened = transport.connect(URI.create(properties.getUrl()), new FrameListener());
        } catch (RuntimeException e) {
            opened = CompletableFuture.failedFuture(e);
        }
        opened.whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                attempt.completeExceptionally(new GatewayException(GatewayException.Kind.NOT_CONNECTED, null,
                    "Failed to open connection: " + cause.getMessage(), null, cause));
                return;
            }
            synchronized (stateLock) {
                if (connectFuture != attempt) {
                    return;
                }
                state = ConnectionState.CONNECTED;
            }
            log.info("WebSocket connected, sending handshake");
            sendRequest("connect", mapper.valueToTree(connectParams()), timeoutMs, false)
                .whenComplete((payload, handshakeError) -> {
                    if (handshakeError != null) {
                        attempt.completeExceptionally(handshakeFailure(asGatewayException(handshakeError)));
                        return;
                    }
                    try {
                        attempt.complete(parseHello(payload));
                    } catch (GatewayException e) {
                        attempt.completeExceptionally(e);
                    } catch (RuntimeException e) {
                        attempt.completeExceptionally(new GatewayException(GatewayException.Kind.AUTH_REJECTED, "connect",
                            "Invalid connect response: " + e.getMessage(), null, e));
                    }
                });
        });
    }

    private ConnectParams connectParams() {
        ConnectParams.ConnectParamsBuilder params = ConnectParams.builder()
            .minProtocol(PROTOCOL_VERSION)
            .maxProtocol(PROTOCOL_VERSION)
            .client(ClientInfo.builder()
                .id(properties.getClientId())
                .version(properties.getClientVersion())
                .platform("java")
                .mode(properties.getRole())
                .displayName(properties.getDisplayName())
                .build())
            .role(properties.getRole())
            .scopes(properties.getScopes())
            .locale(properties.getLocale())
            .userAgent(properties.getClientId() + "/" + properties.getClientVersion());
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            params.auth(Map.of("token", properties.getToken()));
        }
        return params.build();
    }

    private HelloOk parseHello(JsonNode payload) {
        HelloOk helloOk = payload == null || payload.isNull() ? null : read(payload, HelloOk.class, "connect");
        if (helloOk == null) {
            throw new GatewayException(GatewayException.Kind.AUTH_REJECTED, "Empty connect response");
        }
        if (!HelloOk.TYPE.equals(helloOk.getType())) {
            throw new GatewayException(GatewayException.Kind.AUTH_REJECTED, "Unexpected connect response: " + helloOk.getType());
        }
        if (helloOk.getProtocol() < PROTOCOL_VERSION || helloOk.getProtocol() > PROTOCOL_VERSION) {
            throw new GatewayException(GatewayException.Kind.PROTOCOL_MISMATCH,
                "Gateway negotiated protocol " + helloOk.getProtocol() + ", client offers " + PROTOCOL_VERSION);
        }
        return helloOk;
    }

    private static GatewayException handshakeFailure(GatewayException e) {
        switch (e.getKind()) {
            case REQUEST_TIMEOUT:
                return new GatewayException(GatewayException.Kind.CONNECTION_TIMEOUT, "connect",
                    "Handshake timed out", null, e);
            case REQUEST_FAILED:
                String code = e.getRemoteError() != null ? e.getRemoteError().getCode() : null;
                GatewayException.Kind kind = code != null && (PROTOCOL_ERROR_CODES.contains(code) || code.contains("PROTOCOL"))
                    ? GatewayException.Kind.PROTOCOL_MISMATCH
                    : GatewayException.Kind.AUTH_REJECTED;
                return new GatewayException(kind, "connect", e.getMessage(), e.getRemoteError(), e);
            default:
                return e;
        }
    }

    private void onAttemptSettled(CompletableFuture<HelloOk> attempt, HelloOk result, Throwable error) {
        if (error == null) {
            synchronized (stateLock) {
                if (connectFuture != attempt) {
                    return;
                }
                state = ConnectionState.AUTHENTICATED;
                hello = result;
                lastError = null;
                reconnectAttempts = 0;
                reconnectExhausted = false;
            }
            log.info("Authenticated with Clawdbot gateway: protocol={} clientId={}", result.getProtocol(), properties.getClientId());
            notifyListeners(listener -> listener.onAuthenticated(result));
            return;
        }

        GatewayException failure = asGatewayException(error);
        boolean retry;
        synchronized (stateLock) {
            if (connectFuture != attempt) {
                return;
            }
            state = ConnectionState.DISCONNECTED;
            hello = null;
            lastError = failure.getMessage();
            retry = reconnectAttempts > 0;
        }
        log.warn("Connection attempt failed: {}", failure.getMessage());
        transport.close(CLOSE_NORMAL, "Connection attempt failed");
        failAllPending(new GatewayException(GatewayException.Kind.CONNECTION_LOST, "Connection attempt failed"));
        if (retry) {
            scheduleReconnect();
        }
    }

    private void onTransportClosed(int code, String reason) {
        boolean wasAuthenticated;
        CompletableFuture<HelloOk> inFlight;
        synchronized (stateLock) {
            if (state == ConnectionState.DISCONNECTED) {
                return;
            }
            wasAuthenticated = state == ConnectionState.AUTHENTICATED;
            inFlight = connectFuture;
            state = ConnectionState.DISCONNECTED;
            hello = null;
            lastError = reason;
        }
        log.warn("Disconnected from Clawdbot gateway: code={} reason={}", code, reason);

        GatewayException lost = new GatewayException(GatewayException.Kind.CONNECTION_LOST, "Connection closed: " + reason);
        failAllPending(lost);
        if (inFlight != null && !inFlight.isDone()) {
            inFlight.completeExceptionally(lost);
        }
        notifyListeners(listener -> listener.onDisconnected(reason));
        if (wasAuthenticated) {
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        int attempt;
        long delay = 0;
        boolean exhausted = false;
        synchronized (stateLock) {
            if (!autoReconnect || reconnectTimer != null || reconnectExhausted) {
                return;
            }
            if (reconnectAttempts >= properties.getMaxReconnectAttempts()) {
                reconnectExhausted = true;
                exhausted = true;
                attempt = reconnectAttempts;
            } else {
                reconnectAttempts++;
                attempt = reconnectAttempts;
                delay = backoffDelay(properties.getReconnectBaseDelay().toMillis(), attempt);
                reconnectTimer = scheduler.schedule(this::runReconnect, delay, TimeUnit.MILLISECONDS);
            }
        }

        if (exhausted) {
            log.error("Reconnection exhausted after {} attempts, giving up", attempt);
            notifyListeners(listener -> listener.onReconnectExhausted(attempt));
            return;
        }
        log.info("Scheduling reconnection: attempt={}/{} delayMs={}", attempt, properties.getMaxReconnectAttempts(), delay);
        long scheduledDelay = delay;
        notifyListeners(listener -> listener.onReconnecting(attempt, scheduledDelay));
    }

    private void runReconnect() {
        CompletableFuture<HelloOk> attempt;
        synchronized (stateLock) {
            reconnectTimer = null;
            if (!autoReconnect || state != ConnectionState.DISCONNECTED) {
                return;
            }
            attempt = beginAttempt();
        }
        openTransport(attempt);
    }

    // ============================================
    // Helpers
    // ============================================

    private final class FrameListener implements TransportListener {

        @Override
        public void onMessage(String text) {
            GatewayFrame frame;
            try {
                frame = mapper.readValue(text, GatewayFrame.class);
            } catch (JsonProcessingException e) {
                log.error("Failed to parse gateway frame: {}", e.getOriginalMessage());
                return;
            }
            if (frame instanceof ResponseFrame) {
                handleResponse((ResponseFrame) frame);
            } else if (frame instanceof EventFrame) {
                dispatchEvent((EventFrame) frame);
            } else {
                log.debug("Ignoring unexpected frame {}", frame.getClass().getSimpleName());
            }
        }

        @Override
        public void onClose(int code, String reason) {
            onTransportClosed(code, reason);
        }

        @Override
        public void onError(Throwable error) {
            synchronized (stateLock) {
                lastError = error.getMessage();
            }
            log.error("WebSocket error", error);
        }
    }

    private void handleResponse(ResponseFrame response) {
        PendingRequest entry = pending.remove(response.getId());
        if (entry == null) {
            log.debug("Dropping response for unknown or expired request {}", response.getId());
            return;
        }
        if (response.isOk()) {
            log.trace("Request succeeded: id={}", response.getId());
            entry.future.complete(response.getPayload() != null ? response.getPayload() : NullNode.getInstance());
        } else {
            log.debug("Request failed: id={} error={}", response.getId(),
                response.getError() != null ? response.getError().getMessage() : null);
            entry.future.completeExceptionally(GatewayException.remote(entry.method, response.getError()));
        }
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw asGatewayException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(GatewayException.Kind.NOT_CONNECTED, null, "Interrupted while waiting for gateway", null, e);
        }
    }

    private <T> T read(JsonNode node, Class<T> type, String method) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayException.Kind.REQUEST_FAILED, method,
                "Malformed " + method + " payload: " + e.getOriginalMessage(), null, e);
        }
    }

    private <T> T read(JsonNode node, TypeReference<T> type, String method) {
        try {
            return mapper.readValue(mapper.treeAsTokens(node), type);
        } catch (IOException e) {
            throw new GatewayException(GatewayException.Kind.REQUEST_FAILED, method,
                "Malformed " + method + " payload: " + e.getMessage(), null, e);
        }
    }

    private String toJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode config patch", e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static GatewayException asGatewayException(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof GatewayException) {
            return (GatewayException) cause;
        }
        return new GatewayException(GatewayException.Kind.REQUEST_FAILED, null, String.valueOf(cause.getMessage()), null, cause);
    }

    private static final class PendingRequest {
        private final String method;
        private final CompletableFuture<JsonNode> future;

        private PendingRequest(String method, CompletableFuture<JsonNode> future) {
            this.method = method;
            this.future = future;
        }
    }
}
