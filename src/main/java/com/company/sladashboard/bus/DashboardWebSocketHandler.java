package com.company.sladashboard.bus;

import com.company.sladashboard.config.SlaDashboardProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server end of the invalidation bus.
 * <p>
 * Each session is wrapped in a {@link ConcurrentWebSocketSessionDecorator}: sends are
 * serialised in call order, and a slow client's buffer drops its oldest frames instead of
 * blocking other sessions. Delivery is at-most-once; clients fall back to TTL refetches.
 */
@Component
@Slf4j
public class DashboardWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final SlaDashboardProperties.Bus settings;
    private final Clock clock;
    private final Map<String, BusSession> sessions = new ConcurrentHashMap<>();
    private final Counter droppedEvents;

    public DashboardWebSocketHandler(ObjectMapper objectMapper,
                                     SlaDashboardProperties properties,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.objectMapper = objectMapper;
        this.settings = properties.getBus();
        this.clock = clock;
        this.droppedEvents = Counter.builder("sla.bus.events.dropped")
                .description("Event frames that could not be sent to a session")
                .register(meterRegistry);
        Gauge.builder("sla.bus.sessions", sessions, Map::size)
                .description("Connected invalidation bus sessions")
                .register(meterRegistry);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
                session,
                (int) settings.getSendTimeLimit().toMillis(),
                (int) settings.getSendBufferSize().toBytes(),
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.DROP);

        sessions.put(session.getId(), new BusSession(decorated, clock.instant()));
        log.info("Bus session {} connected ({} active)", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        BusSession busSession = sessions.get(session.getId());
        if (busSession == null) {
            return;
        }
        busSession.touch(clock.instant());

        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Malformed frame from session {}: {}", session.getId(), e.getOriginalMessage());
            sendControl(busSession, BusFrames.ERROR, "message", "Malformed frame");
            return;
        }

        String type = frame.path(BusFrames.TYPE).asText("");
        String key = frame.path(BusFrames.KEY).asText(null);

        if (BusFrames.SUBSCRIBE.equals(type)) {
            if (key == null || key.isBlank()) {
                sendControl(busSession, BusFrames.ERROR, "message", "subscribe requires a key");
                return;
            }
            busSession.subscribe(key);
            log.debug("Session {} subscribed to {}", session.getId(), key);
            sendControl(busSession, BusFrames.SUBSCRIBED, BusFrames.KEY, key);

        } else if (BusFrames.UNSUBSCRIBE.equals(type)) {
            if (key != null) {
                busSession.unsubscribe(key);
            }
            sendControl(busSession, BusFrames.UNSUBSCRIBED, BusFrames.KEY, key);

        } else if (BusFrames.PING.equals(type)) {
            sendControl(busSession, BusFrames.PONG, "timestamp", clock.instant().toString());

        } else if (BusFrames.PONG.equals(type)) {
            log.trace("Heartbeat answered by session {}", session.getId());

        } else {
            sendControl(busSession, BusFrames.ERROR, "message", "Unknown frame type: " + type);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Bus session {} transport error: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Bus session {} closed ({}), {} active", session.getId(), status.getCode(), sessions.size());
    }

    /**
     * Send an event to every session interested in one of its keys.
     *
     * @return number of sessions the frame was handed to
     */
    public int deliver(InvalidationEvent event) {
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise bus event {}", event.getEvent(), e);
            return 0;
        }

        int delivered = 0;
        for (BusSession busSession : sessions.values()) {
            if (busSession.accepts(event.getAffectedKeys()) && send(busSession, frame)) {
                delivered++;
            }
        }

        log.debug("Delivered {} to {}/{} sessions", event.getEvent(), delivered, sessions.size());
        return delivered;
    }

    /**
     * Ping live sessions and close the ones silent for longer than the idle timeout.
     */
    public void sendHeartbeats() {
        Instant now = clock.instant();
        Duration idleTimeout = settings.getIdleTimeout();

        for (BusSession busSession : sessions.values()) {
            if (Duration.between(busSession.getLastSeen(), now).compareTo(idleTimeout) > 0) {
                log.info("Closing idle bus session {}", busSession.getId());
                close(busSession, CloseStatus.SESSION_NOT_RELIABLE);
            } else {
                sendControl(busSession, BusFrames.HEARTBEAT_PING, "timestamp", now.toString());
            }
        }
    }

    public int getSessionCount() {
        return sessions.size();
    }

    Set<String> getSubscriptions(String sessionId) {
        BusSession busSession = sessions.get(sessionId);
        return busSession != null ? busSession.getSubscriptions() : Set.of();
    }

    private void sendControl(BusSession busSession, String type, String field, String value) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put(BusFrames.TYPE, type);
        if (value != null) {
            frame.put(field, value);
        }
        try {
            send(busSession, new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise {} frame", type, e);
        }
    }

    private boolean send(BusSession busSession, TextMessage frame) {
        WebSocketSession session = busSession.getSession();
        if (!session.isOpen()) {
            sessions.remove(busSession.getId());
            droppedEvents.increment();
            return false;
        }
        try {
            session.sendMessage(frame);
            return true;
        } catch (SessionLimitExceededException e) {
            log.warn("Bus session {} exceeded send limits, closing: {}", busSession.getId(), e.getMessage());
            droppedEvents.increment();
            sessions.remove(busSession.getId());
            return false;
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send to bus session {}: {}", busSession.getId(), e.getMessage());
            droppedEvents.increment();
            return false;
        }
    }

    private void close(BusSession busSession, CloseStatus status) {
        sessions.remove(busSession.getId());
        try {
            busSession.getSession().close(status);
        } catch (IOException e) {
            log.warn("Failed to close bus session {}: {}", busSession.getId(), e.getMessage());
        }
    }
}
