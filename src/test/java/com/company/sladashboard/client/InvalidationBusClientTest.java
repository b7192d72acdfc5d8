package com.company.sladashboard.client;

import com.company.sladashboard.invalidation.InvalidationCatalog;
import com.company.sladashboard.util.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("InvalidationBusClient Tests")
class InvalidationBusClientTest {

    private static final String URL = "ws://localhost:8080/ws";
    private static final QueryKey DAG_7 = QueryKey.of("tasks", "dagId", 7);
    private static final QueryKey DAG_8 = QueryKey.of("tasks", "dagId", 8);

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private MutableClock clock;
    private ControlledFetcher fetcher;
    private ClientCacheManager manager;
    private WebSocketClient webSocketClient;
    private ScheduledExecutorService reconnectScheduler;
    private InvalidationBusClient busClient;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-15T12:00:00Z"));
        fetcher = new ControlledFetcher();
        manager = new ClientCacheManager(Runnable::run, TtlPolicy.defaults(), new InvalidationCatalog(true), clock);
        manager.registerFetcher("tasks", fetcher);
        webSocketClient = mock(WebSocketClient.class);
        reconnectScheduler = mock(ScheduledExecutorService.class);
        busClient = new InvalidationBusClient(webSocketClient, URL, manager, objectMapper, reconnectScheduler);
    }

    private void seed(QueryKey key, Object value) {
        manager.get(key);
        fetcher.completeLast(value);
    }

    private WebSocketSession connect() {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("bus-1");
        when(session.isOpen()).thenReturn(true);
        busClient.afterConnectionEstablished(session);
        return session;
    }

    private List<JsonNode> sentFrames(WebSocketSession session) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeast(0)).sendMessage(captor.capture());
        List<JsonNode> frames = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            frames.add(objectMapper.readTree(message.getPayload()));
        }
        return frames;
    }

    @Test
    @DisplayName("Backoff starts at one second, doubles, and is capped at thirty")
    void testNextBackoff() {
        assertEquals(Duration.ofSeconds(1), InvalidationBusClient.nextBackoff(0));
        assertEquals(Duration.ofSeconds(2), InvalidationBusClient.nextBackoff(1));
        assertEquals(Duration.ofSeconds(16), InvalidationBusClient.nextBackoff(4));
        assertEquals(Duration.ofSeconds(30), InvalidationBusClient.nextBackoff(5));
        assertEquals(Duration.ofSeconds(30), InvalidationBusClient.nextBackoff(100));
    }

    @Test
    @DisplayName("First connection subscribes active keys and keeps cached data")
    void testFirstConnect() throws Exception {
        manager.subscribe(DAG_7, (key, value) -> { });
        fetcher.completeLast("seven");
        seed(DAG_8, "eight");

        WebSocketSession session = connect();

        assertTrue(busClient.isConnected());
        List<JsonNode> frames = sentFrames(session);
        assertEquals(1, frames.size());
        assertEquals("subscribe", frames.get(0).path("type").asText());
        assertEquals("tasks/dagId=7", frames.get(0).path("key").asText());
        assertFalse(manager.isStale(DAG_7));
        assertFalse(manager.isStale(DAG_8));
    }

    @Test
    @DisplayName("A reconnect invalidates the whole cache and subscribes again")
    void testReconnect_InvalidatesEverything() throws Exception {
        manager.subscribe(DAG_7, (key, value) -> { });
        fetcher.completeLast("seven");
        seed(DAG_8, "eight");
        WebSocketSession first = connect();
        busClient.afterConnectionClosed(first, CloseStatus.SERVER_ERROR);

        WebSocketSession second = connect();

        assertTrue(manager.isStale(DAG_8));
        assertEquals(3, fetcher.callCount());
        assertEquals(DAG_7, fetcher.keyOf(2));
        List<JsonNode> frames = sentFrames(second);
        assertEquals("subscribe", frames.get(0).path("type").asText());
        assertEquals("tasks/dagId=7", frames.get(0).path("key").asText());
    }

    @Test
    @DisplayName("Keys gaining or losing their listeners are subscribed or unsubscribed")
    void testActivationFrames() throws Exception {
        WebSocketSession session = connect();

        Subscription subscription = manager.subscribe(DAG_7, (key, value) -> { });
        subscription.close();

        List<JsonNode> frames = sentFrames(session);
        assertEquals(2, frames.size());
        assertEquals("subscribe", frames.get(0).path("type").asText());
        assertEquals("unsubscribe", frames.get(1).path("type").asText());
        assertEquals("tasks/dagId=7", frames.get(1).path("key").asText());
    }

    @Test
    @DisplayName("An event frame invalidates only the matching entries")
    void testEventFrame() {
        seed(DAG_7, "seven");
        seed(DAG_8, "eight");
        WebSocketSession session = connect();

        busClient.handleTextMessage(session, new TextMessage(
                "{\"event\":\"TASK_PRIORITY_CHANGED\",\"affectedKeys\":[\"tasks/dagId=7\",\"team-dashboard/teamId=10\"],"
                        + "\"context\":{\"dagId\":7},\"timestamp\":\"2026-03-15T12:00:00Z\"}"));

        assertTrue(manager.isStale(DAG_7));
        assertFalse(manager.isStale(DAG_8));
    }

    @Test
    @DisplayName("A wildcard event invalidates everything")
    void testEventFrame_Wildcard() {
        seed(DAG_7, "seven");
        seed(DAG_8, "eight");
        WebSocketSession session = connect();

        busClient.handleTextMessage(session, new TextMessage(
                "{\"event\":\"cache-updated\",\"affectedKeys\":[\"*\"],\"context\":{\"version\":3}}"));

        assertTrue(manager.isStale(DAG_7));
        assertTrue(manager.isStale(DAG_8));
    }

    @Test
    @DisplayName("Heartbeat pings are answered and malformed frames ignored")
    void testHeartbeatAndMalformed() throws Exception {
        seed(DAG_7, "seven");
        WebSocketSession session = connect();

        busClient.handleTextMessage(session, new TextMessage("{\"type\":\"heartbeat-ping\",\"timestamp\":\"now\"}"));
        busClient.handleTextMessage(session, new TextMessage("not json"));

        List<JsonNode> frames = sentFrames(session);
        assertEquals(1, frames.size());
        assertEquals("pong", frames.get(0).path("type").asText());
        assertFalse(manager.isStale(DAG_7));
    }

    @Test
    @DisplayName("Each heartbeat sweeps expired entries nobody listens to")
    void testHeartbeat_EvictsExpired() {
        seed(DAG_7, "seven");
        manager.subscribe(DAG_8, (key, value) -> { });
        fetcher.completeLast("eight");
        WebSocketSession session = connect();
        clock.advance(Duration.ofMinutes(6));

        busClient.handleTextMessage(session, new TextMessage("{\"type\":\"heartbeat-ping\"}"));

        assertFalse(manager.contains(DAG_7));
        assertTrue(manager.contains(DAG_8));
    }

    @Test
    @DisplayName("A team dashboard event reaches the tenant-scoped entry the client loads")
    void testEventFrame_TenantScopedTeamDashboard() {
        QueryKey dashboard = TaskMutations.teamDashboardKey("Data Engineering", 10L);
        QueryKey otherTeam = TaskMutations.teamDashboardKey("Data Engineering", 20L);
        manager.registerFetcher("team-dashboard", fetcher);
        seed(dashboard, 92.0);
        seed(otherTeam, 71.0);
        WebSocketSession session = connect();

        busClient.handleTextMessage(session, new TextMessage(
                "{\"event\":\"TASK_PRIORITY_CHANGED\",\"affectedKeys\":[\"tasks/dagId=7\",\"team-dashboard/teamId=10\"]}"));

        assertTrue(manager.isStale(dashboard));
        assertFalse(manager.isStale(otherTeam));
    }

    @Test
    @DisplayName("A failed connection attempt is retried with growing delays")
    void testConnectFailure_SchedulesReconnect() {
        when(webSocketClient.execute(any(WebSocketHandler.class), eq(URL)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection refused")));

        busClient.start();

        ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
        verify(reconnectScheduler).schedule(retry.capture(), eq(1000L), eq(TimeUnit.MILLISECONDS));

        retry.getValue().run();

        verify(reconnectScheduler).schedule(any(Runnable.class), eq(2000L), eq(TimeUnit.MILLISECONDS));
        verify(webSocketClient, times(2)).execute(busClient, URL);
    }

    @Test
    @DisplayName("No reconnect is attempted after stop")
    void testStop() throws Exception {
        when(webSocketClient.execute(any(WebSocketHandler.class), eq(URL))).thenReturn(new CompletableFuture<>());
        busClient.start();
        WebSocketSession session = connect();

        busClient.stop();
        busClient.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertFalse(busClient.isConnected());
        verify(session).close(CloseStatus.NORMAL);
        verify(reconnectScheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }
}
