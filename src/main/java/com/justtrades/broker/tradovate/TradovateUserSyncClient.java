package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.justtrades.broker.BrokerEventListener;
import com.justtrades.config.TradovateConfig;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tradovate user-sync WebSocket for one access token.
 *
 * <p>Frame protocol: the server sends {@code o} on open, {@code h} as heartbeat
 * and {@code a[...]} carrying JSON messages. Requests are
 * {@code endpoint\nrequestId\n\nbody}. After {@code authorize} the client issues
 * {@code user/syncrequest} for its accounts and from then on receives
 * {@code props} events for orders, fills and positions.
 *
 * <p>Fills carry only an order id, so the account is resolved from order events
 * seen earlier on the same stream. A fill for an unknown order is dropped here;
 * the drift audit picks it up from the fill history.
 */
public class TradovateUserSyncClient implements WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(TradovateUserSyncClient.class);

    private final String url;
    private final String accessToken;
    private final List<Long> accountIds;
    private final BrokerEventListener listener;
    private final LongFunction<String> symbolResolver;
    private final ObjectMapper objectMapper;
    private final TradovateConfig tradovateConfig;

    private final AtomicReference<WebSocket> webSocket = new AtomicReference<>();
    private final AtomicBoolean shouldReconnect = new AtomicBoolean(true);
    private final Map<Long, Long> accountByOrderId = new ConcurrentHashMap<>();
    private final StringBuilder messageBuffer = new StringBuilder();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "tradovate-user-sync");
        t.setDaemon(true);
        return t;
    });

    public TradovateUserSyncClient(
            String url,
            String accessToken,
            List<Long> accountIds,
            BrokerEventListener listener,
            LongFunction<String> symbolResolver,
            ObjectMapper objectMapper,
            TradovateConfig tradovateConfig) {
        this.url = url;
        this.accessToken = accessToken;
        this.accountIds = List.copyOf(accountIds);
        this.listener = listener;
        this.symbolResolver = symbolResolver;
        this.objectMapper = objectMapper;
        this.tradovateConfig = tradovateConfig;
        long heartbeatMs = tradovateConfig.getHeartbeatInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::heartbeat, heartbeatMs, heartbeatMs, TimeUnit.MILLISECONDS);
    }

    public void connect() {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(tradovateConfig.getConnectTimeout())
                .build();
        client.newWebSocketBuilder()
                .connectTimeout(tradovateConfig.getConnectTimeout())
                .buildAsync(URI.create(url), this)
                .whenComplete((ws, error) -> {
                    if (error != null) {
                        log.error("Tradovate user sync connect failed for {}: {}", url, error.getMessage());
                        scheduleReconnect();
                    } else {
                        webSocket.set(ws);
                        log.info("Tradovate user sync connected: {} accounts on {}", accountIds.size(), url);
                    }
                });
    }

    public void close() {
        shouldReconnect.set(false);
        WebSocket ws = webSocket.getAndSet(null);
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown");
        }
        scheduler.shutdownNow();
    }

    // ========================
    // WEBSOCKET CALLBACKS
    // ========================

    @Override
    public void onOpen(WebSocket ws) {
        ws.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        messageBuffer.append(data);
        if (last) {
            String frame = messageBuffer.toString();
            messageBuffer.setLength(0);
            handleFrame(ws, frame);
        }
        ws.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onPing(WebSocket ws, ByteBuffer message) {
        ws.sendPong(message);
        ws.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        log.warn("Tradovate user sync closed: {} {}", statusCode, reason);
        webSocket.compareAndSet(ws, null);
        scheduleReconnect();
        return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
        log.error("Tradovate user sync error: {}", error.getMessage());
        webSocket.compareAndSet(ws, null);
        scheduleReconnect();
    }

    // ========================
    // FRAMES
    // ========================

    void handleFrame(WebSocket ws, String frame) {
        if (frame.isEmpty()) {
            return;
        }
        switch (frame.charAt(0)) {
            case 'o' -> {
                ws.sendText("authorize\n0\n\n" + accessToken, true);
                ws.sendText("user/syncrequest\n1\n\n" + syncBody(), true);
            }
            case 'h' -> log.trace("heartbeat");
            case 'a' -> handleMessages(frame.substring(1));
            case 'c' -> log.warn("Tradovate user sync close frame: {}", frame);
            default -> log.debug("Unrecognised frame: {}", frame);
        }
    }

    void handleMessages(String payload) {
        try {
            JsonNode messages = objectMapper.readTree(payload);
            for (JsonNode message : messages) {
                if ("props".equals(message.path("e").asText())) {
                    handleProps(message.path("d"));
                } else if (message.has("s") && message.path("s").asInt() >= 400) {
                    log.error("Tradovate request {} failed: {}", message.path("i").asText(), message.path("d"));
                } else if (message.path("d").has("orders") || message.path("d").has("fills")) {
                    handleInitialSync(message.path("d"));
                }
            }
        } catch (Exception e) {
            log.error("Failed to process user sync payload: {}", e.getMessage(), e);
        }
    }

    private void handleInitialSync(JsonNode data) {
        for (JsonNode order : data.path("orders")) {
            accountByOrderId.put(order.path("id").asLong(), order.path("accountId").asLong());
        }
        log.info("Tradovate user sync ready: {} known orders", accountByOrderId.size());
    }

    private void handleProps(JsonNode data) {
        String entityType = data.path("entityType").asText();
        JsonNode entity = data.path("entity");
        switch (entityType) {
            case "order" -> onOrder(entity);
            case "fill" -> onFill(entity);
            case "position" -> onPosition(entity);
            default -> log.trace("Ignoring {} event", entityType);
        }
    }

    private void onOrder(JsonNode order) {
        long orderId = order.path("id").asLong();
        long accountId = order.path("accountId").asLong();
        accountByOrderId.put(orderId, accountId);
        if ("Rejected".equals(order.path("ordStatus").asText())) {
            String reason = order.path("rejectReason").asText(order.path("text").asText("rejected"));
            listener.onOrderRejected(String.valueOf(accountId), String.valueOf(orderId), reason);
        }
    }

    private void onFill(JsonNode node) {
        TradovateFill fill = objectMapper.convertValue(node, TradovateFill.class);
        if (Boolean.FALSE.equals(fill.active())) {
            return;
        }
        Long accountId = accountByOrderId.get(fill.orderId());
        if (accountId == null) {
            log.warn("Fill {} for unknown order {}; leaving it to the drift audit", fill.id(), fill.orderId());
            return;
        }
        String symbol = symbolResolver.apply(fill.contractId());
        listener.onFill(String.valueOf(accountId), symbol, TradovateBrokerGateway.toBrokerFill(fill));
    }

    private void onPosition(JsonNode node) {
        TradovatePosition position = objectMapper.convertValue(node, TradovatePosition.class);
        String symbol = symbolResolver.apply(position.contractId());
        listener.onPositionSnapshot(String.valueOf(position.accountId()), symbol, position.netPos());
    }

    // ========================
    // CONNECTION
    // ========================

    private String syncBody() {
        try {
            return objectMapper.writeValueAsString(Map.of("accounts", accountIds));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot serialise sync request", e);
        }
    }

    private void heartbeat() {
        WebSocket ws = webSocket.get();
        if (ws != null) {
            ws.sendText("[]", true);
        }
    }

    private void scheduleReconnect() {
        if (!shouldReconnect.get() || scheduler.isShutdown()) {
            return;
        }
        long delay = tradovateConfig.getReconnectDelay().toMillis();
        log.info("Reconnecting Tradovate user sync in {} ms", delay);
        scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
    }
}
