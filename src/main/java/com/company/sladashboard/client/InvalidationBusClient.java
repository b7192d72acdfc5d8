package com.company.sladashboard.client;

import com.company.sladashboard.bus.BusFrames;
import com.company.sladashboard.bus.InvalidationEvent;
import com.company.sladashboard.invalidation.CacheKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client end of the invalidation bus: applies event frames to a {@link ClientCacheManager}.
 * <p>
 * Subscribes every key the cache has listeners for, and follows keys as they are
 * activated or released. After any reconnect the whole cache is invalidated, since events
 * sent while disconnected are lost. Each heartbeat from the server also sweeps expired,
 * unobserved entries out of the cache.
 */
@Slf4j
public class InvalidationBusClient extends TextWebSocketHandler {

    static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_BYTES = 64 * 1024;

    private final WebSocketClient webSocketClient;
    private final String url;
    private final ClientCacheManager cacheManager;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService reconnectScheduler;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean connectedBefore = new AtomicBoolean();
    private final AtomicInteger failedAttempts = new AtomicInteger();
    private volatile WebSocketSession session;

    public InvalidationBusClient(WebSocketClient webSocketClient,
                                 String url,
                                 ClientCacheManager cacheManager,
                                 ObjectMapper objectMapper,
                                 ScheduledExecutorService reconnectScheduler) {
        this.webSocketClient = webSocketClient;
        this.url = url;
        this.cacheManager = cacheManager;
        this.objectMapper = objectMapper;
        this.reconnectScheduler = reconnectScheduler;

        cacheManager.onKeyActivated(key -> sendFrame(BusFrames.SUBSCRIBE, key.getCanonical()));
        cacheManager.onKeyReleased(key -> sendFrame(BusFrames.UNSUBSCRIBE, key.getCanonical()));
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            connect();
        }
    }

    public void stop() {
        running.set(false);
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Failed to close bus connection: {}", e.getMessage());
            }
        }
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    private void connect() {
        log.debug("Connecting to invalidation bus at {}", url);
        webSocketClient.execute(this, url).whenComplete((connected, error) -> {
            if (error != null) {
                log.warn("Bus connection to {} failed: {}", url, error.getMessage());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (!running.get()) {
            return;
        }
        Duration delay = nextBackoff(failedAttempts.getAndIncrement());
        log.info("Reconnecting to invalidation bus in {} ms", delay.toMillis());
        reconnectScheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * One second, doubling per failed attempt, capped at thirty seconds.
     */
    static Duration nextBackoff(int attempt) {
        long millis = INITIAL_BACKOFF.toMillis() << Math.min(attempt, 16);
        return Duration.ofMillis(Math.min(millis, MAX_BACKOFF.toMillis()));
    }

    // ============================================================
    // WebSocket callbacks
    // ============================================================

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) {
        session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_BYTES);
        failedAttempts.set(0);
        boolean reconnected = connectedBefore.getAndSet(true);
        log.info("Connected to invalidation bus{}", reconnected ? " (reconnect)" : "");

        cacheManager.getEventLoop().execute(() -> {
            if (reconnected) {
                cacheManager.invalidateAll();
            }
            for (String key : cacheManager.activeKeys()) {
                sendFrame(BusFrames.SUBSCRIBE, key);
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession rawSession, TextMessage message) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed bus frame: {}", e.getOriginalMessage());
            return;
        }

        if (frame.has("event")) {
            InvalidationEvent event;
            try {
                event = objectMapper.treeToValue(frame, InvalidationEvent.class);
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unreadable bus event: {}", e.getOriginalMessage());
                return;
            }
            cacheManager.getEventLoop().execute(() -> apply(event));
            return;
        }

        String type = frame.path(BusFrames.TYPE).asText("");
        if (BusFrames.HEARTBEAT_PING.equals(type)) {
            sendFrame(BusFrames.PONG, null);
            cacheManager.getEventLoop().execute(cacheManager::evictExpired);
        } else if (BusFrames.ERROR.equals(type)) {
            log.warn("Bus reported an error: {}", frame.path("message").asText());
        } else {
            log.trace("Bus control frame {}", type);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession rawSession, Throwable exception) {
        log.warn("Bus transport error: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession rawSession, CloseStatus status) {
        session = null;
        log.info("Bus connection closed ({})", status.getCode());
        scheduleReconnect();
    }

    /**
     * Apply one event on the event loop. A wildcard key invalidates the whole cache.
     */
    void apply(InvalidationEvent event) {
        if (event.getAffectedKeys() == null || event.getAffectedKeys().isEmpty()) {
            return;
        }
        if (event.getAffectedKeys().contains(CacheKeys.ALL)) {
            cacheManager.invalidateAll();
            return;
        }
        int invalidated = cacheManager.invalidate(event.getAffectedKeys());
        log.debug("{} invalidated {} client entries", event.getEvent(), invalidated);
    }

    private void sendFrame(String type, String key) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(BusFrames.TYPE, type);
        if (key != null) {
            frame.put(BusFrames.KEY, key);
        }
        try {
            current.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send {} frame: {}", type, e.getMessage());
        }
    }
}
