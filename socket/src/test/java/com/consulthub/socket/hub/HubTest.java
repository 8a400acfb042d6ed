package com.consulthub.socket.hub;

import com.consulthub.core.metrics.MetricsNames;
import com.consulthub.core.metrics.MetricsTags;
import com.consulthub.core.msg.Envelope;
import com.consulthub.core.util.JsonUtils;
import com.consulthub.socket.config.SocketConfig;
import com.consulthub.socket.metrics.MetricsService;
import com.consulthub.socket.metrics.MetricsService.EvictionReason;
import com.consulthub.socket.session.Connection;
import com.consulthub.socket.session.ConnectionFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HubTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final long NOW_MILLIS = 1_760_000_000_000L;
    private static final String ROOM = "sess-42";

    private SimpleMeterRegistry registry;
    private MetricsService metricsService;
    private Hub hub;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        SocketConfig config = SocketConfig.builder()
            .nodeId("test-node")
            .httpPort(0)
            .wsPath("/ws")
            .sendQueueSize(16)
            .maxFrameBytes(65536)
            .pingInterval(Duration.ofSeconds(54))
            .idleTimeout(Duration.ofSeconds(60))
            .writeTimeout(Duration.ofSeconds(10))
            .tokenSecret("secret")
            .build();

        registry = new SimpleMeterRegistry();
        metricsService = new MetricsService(registry, config);
        hub = new Hub(metricsService, Clock.fixed(Instant.ofEpochMilli(NOW_MILLIS), ZoneOffset.UTC));
        hub.start();
        factory = new ConnectionFactory(config);
    }

    @AfterEach
    void tearDown() {
        hub.stop();
    }

    @Test
    @DisplayName("Registration enqueues a connection_confirmed envelope and adds the connection")
    void testRegisterConfirms() {
        Connection connection = factory.create("u1");
        List<Envelope> received = drain(connection);

        assertEquals(Boolean.TRUE, hub.register(connection).block(TIMEOUT));

        assertEquals(1, received.size());
        Envelope confirmation = received.get(0);
        assertEquals("connection_confirmed", confirmation.getType());
        assertEquals("connected", confirmation.getData().get("status").asText());
        assertEquals(NOW_MILLIS, confirmation.getTimestamp());

        HubSnapshot snapshot = hub.snapshot().block(TIMEOUT);
        assertEquals(List.of(connection.getId()), snapshot.getConnectionIds());
        assertEquals(1, snapshot.getConnectedUsers());
    }

    @Test
    @DisplayName("A connection closed before its registration runs is never added")
    void testRegisterClosedConnectionSkipped() {
        Connection connection = factory.create("u1");
        connection.close();

        assertEquals(Boolean.FALSE, hub.register(connection).block(TIMEOUT));
        assertEquals(0, hub.snapshot().block(TIMEOUT).getConnectionCount());
    }

    @Test
    @DisplayName("Unregister is idempotent and removes the connection from every room")
    void testUnregisterIdempotent() {
        Connection connection = registered("u1");
        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);
        hub.dispatch(join("u1", "sess-7")).block(TIMEOUT);
        assertEquals(2, connection.getJoinedRooms().size());

        assertEquals(Boolean.TRUE, hub.unregister(connection).block(TIMEOUT));
        assertEquals(Boolean.FALSE, hub.unregister(connection).block(TIMEOUT));

        assertTrue(connection.isClosed());
        assertTrue(connection.getJoinedRooms().isEmpty());
        HubSnapshot snapshot = hub.snapshot().block(TIMEOUT);
        assertEquals(0, snapshot.getConnectionCount());
        assertEquals(0, snapshot.getRoomCount(), "Rooms must be deleted when their last member leaves");
    }

    @Test
    @DisplayName("Chat from u1 reaches u1 and u2 in sess-42 but not u3")
    void testChatScenario() {
        Connection c1 = registered("u1");
        Connection c2 = registered("u2");
        Connection c3 = registered("u3");
        List<Envelope> r1 = drain(c1);
        List<Envelope> r2 = drain(c2);
        List<Envelope> r3 = drain(c3);

        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);
        hub.dispatch(join("u2", ROOM)).block(TIMEOUT);
        hub.dispatch(chat("u1", ROOM, "hello")).block(TIMEOUT);

        for (List<Envelope> received : List.of(r1, r2)) {
            assertEquals(List.of("connection_confirmed", "chat_message"), types(received));
            Envelope message = received.get(1);
            assertEquals("hello", message.getData().get("content").asText());
            assertEquals("u1", message.getUserId());
            assertEquals(ROOM, message.getSessionId());
            assertEquals(NOW_MILLIS, message.getTimestamp());
        }
        assertEquals(List.of("connection_confirmed"), types(r3));
    }

    @Test
    @DisplayName("Joining sends nothing to the room")
    void testJoinIsSilent() {
        Connection c1 = registered("u1");
        List<Envelope> r1 = drain(c1);
        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);

        registered("u2");
        hub.dispatch(join("u2", ROOM)).block(TIMEOUT);

        assertEquals(List.of("connection_confirmed"), types(r1));
        assertEquals(2, hub.roomParticipants(ROOM).block(TIMEOUT));
    }

    @Test
    @DisplayName("Join accepts the legacy consultationId key")
    void testJoinWithConsultationId() {
        Connection connection = registered("u1");
        ObjectNode data = JsonUtils.objectNode().put("consultationId", ROOM);

        hub.dispatch(envelope("join_consultation", "u1", data)).block(TIMEOUT);

        assertTrue(connection.getJoinedRooms().contains(ROOM));
    }

    @Test
    @DisplayName("Join without a session id is dropped")
    void testJoinWithoutSessionId() {
        Connection connection = registered("u1");

        hub.dispatch(envelope("join_consultation", "u1", JsonUtils.objectNode())).block(TIMEOUT);
        hub.dispatch(envelope("join_consultation", "u1", null)).block(TIMEOUT);

        assertTrue(connection.getJoinedRooms().isEmpty());
        assertEquals(0, hub.snapshot().block(TIMEOUT).getRoomCount());
    }

    @Test
    @DisplayName("Leave removes the sender and deletes the room once empty")
    void testLeave() {
        Connection c1 = registered("u1");
        registered("u2");
        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);
        hub.dispatch(join("u2", ROOM)).block(TIMEOUT);

        hub.dispatch(leave("u1", ROOM)).block(TIMEOUT);
        assertEquals(1, hub.roomParticipants(ROOM).block(TIMEOUT));
        assertFalse(c1.getJoinedRooms().contains(ROOM));

        hub.dispatch(leave("u2", ROOM)).block(TIMEOUT);
        assertEquals(0, hub.roomParticipants(ROOM).block(TIMEOUT));
        assertFalse(hub.snapshot().block(TIMEOUT).getRooms().containsKey(ROOM));
    }

    @Test
    @DisplayName("leaveRoom removes membership on both sides and deletes the emptied room")
    void testLeaveRoomDirect() {
        Connection c1 = registered("u1");
        registered("u2");
        assertTrue(hub.joinRoom("u1", ROOM).block(TIMEOUT));

        assertTrue(hub.leaveRoom("u1", ROOM).block(TIMEOUT));
        assertFalse(hub.leaveRoom("u1", ROOM).block(TIMEOUT));
        assertFalse(hub.leaveRoom("u2", ROOM).block(TIMEOUT));
        assertFalse(hub.leaveRoom("nobody", ROOM).block(TIMEOUT));

        assertEquals(0, hub.roomParticipants(ROOM).block(TIMEOUT));
        assertEquals(0, hub.roomCount().block(TIMEOUT));
        assertFalse(hub.snapshot().block(TIMEOUT).getRooms().containsKey(ROOM));
        assertEquals(Set.of(), c1.getJoinedRooms());
        assertEquals(Set.of(), hub.roomsOf(c1).block(TIMEOUT));
    }

    @Test
    @DisplayName("Chat from a non-member is dropped")
    void testChatFromNonMemberDropped() {
        Connection c1 = registered("u1");
        registered("u2");
        List<Envelope> r1 = drain(c1);
        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);

        hub.dispatch(chat("u2", ROOM, "let me in")).block(TIMEOUT);

        assertEquals(List.of("connection_confirmed"), types(r1));
    }

    @Test
    @DisplayName("Typing indicators go to every member except the typist")
    void testTypingExcludesSender() {
        Connection c1 = registered("u1");
        Connection c2 = registered("u2");
        List<Envelope> r1 = drain(c1);
        List<Envelope> r2 = drain(c2);
        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);
        hub.dispatch(join("u2", ROOM)).block(TIMEOUT);

        hub.dispatch(envelope("typing_start", "u1", sessionData(ROOM))).block(TIMEOUT);
        hub.dispatch(envelope("typing_stop", "u1", sessionData(ROOM))).block(TIMEOUT);

        assertEquals(List.of("connection_confirmed"), types(r1));
        assertEquals(List.of("connection_confirmed", "typing_start", "typing_stop"), types(r2));
        Envelope typing = r2.get(1);
        assertEquals("u1", typing.getData().get("userId").asText());
        assertEquals("u1", typing.getUserId());
        assertEquals(ROOM, typing.getSessionId());
    }

    @Test
    @DisplayName("Ping is answered with pong to the sender only")
    void testPingPong() {
        Connection c1 = registered("u1");
        Connection c2 = registered("u2");
        List<Envelope> r1 = drain(c1);
        List<Envelope> r2 = drain(c2);
        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);
        hub.dispatch(join("u2", ROOM)).block(TIMEOUT);

        hub.dispatch(envelope("ping", "u1", null)).block(TIMEOUT);

        assertEquals(List.of("connection_confirmed", "pong"), types(r1));
        assertNull(r1.get(1).getData());
        assertEquals(NOW_MILLIS, r1.get(1).getTimestamp());
        assertEquals(List.of("connection_confirmed"), types(r2));
    }

    @Test
    @DisplayName("Unknown and server-side types are ignored and the hub keeps serving")
    void testUnknownTypesIgnored() {
        Connection c1 = registered("u1");
        List<Envelope> r1 = drain(c1);
        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);

        hub.dispatch(envelope("presence_update", "u1", sessionData(ROOM))).block(TIMEOUT);
        hub.dispatch(envelope("connection_confirmed", "u1", sessionData(ROOM))).block(TIMEOUT);
        hub.dispatch(chat("u1", ROOM, "still here")).block(TIMEOUT);

        assertEquals(List.of("connection_confirmed", "chat_message"), types(r1));
        Counter unknown = registry.find(MetricsNames.ENVELOPES_INBOUND_TOTAL)
            .tag(MetricsTags.TYPE, "unknown")
            .counter();
        assertNotNull(unknown);
        assertEquals(1.0, unknown.count());
    }

    @Test
    @DisplayName("A member with a full queue is evicted while the others still receive")
    void testBackpressureEviction() {
        ConnectionFactory smallQueues = new ConnectionFactory(2);
        Connection slow = smallQueues.create("slow");
        Connection fast1 = smallQueues.create("fast1");
        Connection fast2 = smallQueues.create("fast2");
        List<Envelope> r1 = drain(fast1);
        List<Envelope> r2 = drain(fast2);

        for (Connection connection : List.of(slow, fast1, fast2)) {
            assertEquals(Boolean.TRUE, hub.register(connection).block(TIMEOUT));
            assertEquals(Boolean.TRUE, hub.joinRoom(connection.getUserId(), ROOM).block(TIMEOUT));
        }

        // Confirmation plus this broadcast fill the slow queue
        assertEquals(3, hub.broadcastToRoom(ROOM, chatPayload("first")).block(TIMEOUT));
        assertEquals(2, hub.broadcastToRoom(ROOM, chatPayload("second")).block(TIMEOUT));

        assertTrue(slow.isClosed());
        assertTrue(slow.getJoinedRooms().isEmpty());
        HubSnapshot snapshot = hub.snapshot().block(TIMEOUT);
        assertFalse(snapshot.getConnectionIds().contains(slow.getId()));
        assertEquals(List.of(fast1.getId(), fast2.getId()), snapshot.getRooms().get(ROOM));
        assertEquals(1.0, metricsService.getEvictionCount(EvictionReason.QUEUE_FULL));

        assertEquals(List.of("connection_confirmed", "chat_message", "chat_message"), types(r1));
        assertEquals(List.of("connection_confirmed", "chat_message", "chat_message"), types(r2));

        // The evicted queue still drains what it accepted, then completes
        StepVerifier.create(slow.outbound())
            .expectNextMatches(env -> env.getType().equals("connection_confirmed"))
            .expectNextMatches(env -> env.getData().get("content").asText().equals("first"))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    @DisplayName("A connection whose confirmation cannot be enqueued is dropped")
    void testRegisterWithFullQueue() {
        Connection connection = factory.create("u1");
        for (int i = 0; i < connection.getQueueCapacity(); i++) {
            assertTrue(connection.offer(chatPayload("filler-" + i)));
        }

        assertEquals(Boolean.FALSE, hub.register(connection).block(TIMEOUT));
        assertTrue(connection.isClosed());
        assertEquals(0, hub.snapshot().block(TIMEOUT).getConnectionCount());
    }

    @Test
    @DisplayName("Room operations act on the user's most recent connection")
    void testMostRecentConnection() {
        Connection first = registered("u1");
        Connection second = registered("u1");

        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);
        assertEquals(List.of(second.getId()), hub.snapshot().block(TIMEOUT).getRooms().get(ROOM));
        assertEquals(1, hub.snapshot().block(TIMEOUT).getConnectedUsers());

        hub.unregister(second).block(TIMEOUT);
        assertEquals(0, hub.roomParticipants(ROOM).block(TIMEOUT));

        hub.dispatch(join("u1", ROOM)).block(TIMEOUT);
        assertEquals(List.of(first.getId()), hub.snapshot().block(TIMEOUT).getRooms().get(ROOM));
    }

    @Test
    @DisplayName("Broadcast to a user reaches all of that user's connections")
    void testBroadcastToUser() {
        Connection first = registered("u1");
        Connection second = registered("u1");
        Connection other = registered("u2");
        List<Envelope> r1 = drain(first);
        List<Envelope> r2 = drain(second);
        List<Envelope> r3 = drain(other);

        Envelope notice = Envelope.builder().type("chat_message").data(JsonUtils.objectNode().put("content", "hi")).build();
        assertEquals(2, hub.broadcastToUser("u1", notice).block(TIMEOUT));

        assertEquals(2, r1.size());
        assertEquals(2, r2.size());
        assertEquals(NOW_MILLIS, r1.get(1).getTimestamp());
        assertEquals(1, r3.size());
    }

    @Test
    @DisplayName("Broadcast to a missing room delivers to nobody")
    void testBroadcastToMissingRoom() {
        registered("u1");

        assertEquals(0, hub.broadcastToRoom("nowhere", chatPayload("x")).block(TIMEOUT));
        assertEquals(0, hub.snapshot().block(TIMEOUT).getRoomCount());
    }

    @Test
    @DisplayName("Concurrent broadcasts are observed in the same order by every member")
    void testConcurrentBroadcastOrdering() {
        List<List<Envelope>> inboxes = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Connection connection = factory.create("member-" + i);
            inboxes.add(drain(connection));
            hub.register(connection).block(TIMEOUT);
            hub.joinRoom(connection.getUserId(), ROOM).block(TIMEOUT);
        }

        Flux.range(0, 4)
            .parallel(4)
            .runOn(Schedulers.parallel())
            .flatMap(sender -> Flux.range(0, 25)
                .concatMap(seq -> hub.broadcastToRoom(ROOM, chatPayload(sender + "-" + seq))))
            .sequential()
            .then()
            .block(Duration.ofSeconds(10));

        List<String> reference = contents(inboxes.get(0));
        assertEquals(100, reference.size());
        for (List<Envelope> inbox : inboxes) {
            assertEquals(reference, contents(inbox));
        }
    }

    @Test
    @DisplayName("Concurrent registrations are never half-visible to a broadcast")
    void testConcurrentRegisterAndBroadcast() {
        // Nobody drains these queues, so they must hold every broadcast
        ConnectionFactory roomy = new ConnectionFactory(1024);
        Connection anchor = roomy.create("anchor");
        hub.register(anchor).block(TIMEOUT);
        hub.joinRoom("anchor", ROOM).block(TIMEOUT);

        List<Connection> joiners = new CopyOnWriteArrayList<>();
        Flux.range(0, 40)
            .parallel(4)
            .runOn(Schedulers.parallel())
            .flatMap(i -> {
                Connection connection = roomy.create("joiner-" + i);
                joiners.add(connection);
                return hub.register(connection)
                    .then(hub.joinRoom(connection.getUserId(), ROOM))
                    .then(hub.broadcastToRoom(ROOM, chatPayload("from-" + i)));
            })
            .sequential()
            .then()
            .block(Duration.ofSeconds(10));

        HubSnapshot snapshot = hub.snapshot().block(TIMEOUT);
        assertEquals(41, snapshot.getConnectionCount());
        assertEquals(41, snapshot.getRooms().get(ROOM).size());
        assertTrue(anchor.getJoinedRooms().contains(ROOM));
        for (Connection connection : joiners) {
            assertEquals(Set.of(ROOM), connection.getJoinedRooms());
            // First queued envelope is always the confirmation
            StepVerifier.create(connection.outbound().take(1))
                .expectNextMatches(env -> env.getType().equals("connection_confirmed"))
                .expectComplete()
                .verify(TIMEOUT);
        }
    }

    @Test
    @DisplayName("Count queries reflect connections, users and rooms")
    void testCountQueries() {
        Connection first = registered("u1");
        registered("u1");
        registered("u2");
        hub.joinRoom("u2", ROOM).block(TIMEOUT);
        hub.joinRoom("u2", "sess-7").block(TIMEOUT);

        assertEquals(3, hub.connectionCount().block(TIMEOUT));
        assertEquals(2, hub.connectedUsers().block(TIMEOUT));
        assertEquals(2, hub.roomCount().block(TIMEOUT));
        assertEquals(Set.of(), hub.roomsOf(first).block(TIMEOUT));

        hub.unregister(first).block(TIMEOUT);
        assertEquals(2, hub.connectionCount().block(TIMEOUT));
        assertEquals(2, hub.connectedUsers().block(TIMEOUT));
    }

    @Test
    @DisplayName("Stopping the hub closes connections and rejects further operations")
    void testStop() {
        Connection connection = registered("u1");

        hub.stop();

        assertFalse(hub.isRunning());
        assertTrue(connection.isClosed());
        StepVerifier.create(hub.register(factory.create("u2")))
            .expectError(IllegalStateException.class)
            .verify(TIMEOUT);
        StepVerifier.create(connection.onClose()).expectComplete().verify(TIMEOUT);
    }

    @Test
    @DisplayName("Concurrent start calls leave a single working coordinator")
    void testConcurrentStart() {
        Hub fresh = new Hub(metricsService);
        try {
            Flux.range(0, 16)
                .parallel(8)
                .runOn(Schedulers.parallel())
                .doOnNext(i -> fresh.start())
                .sequential()
                .then()
                .block(TIMEOUT);

            assertTrue(fresh.isRunning());
            Connection connection = factory.create("u1");
            assertTrue(fresh.register(connection).block(TIMEOUT));

            fresh.stop();
            assertTrue(connection.isClosed());
            assertFalse(fresh.isRunning());
        } finally {
            fresh.stop();
        }
    }

    @Test
    @DisplayName("A stopped hub can be started again")
    void testRestartAfterStop() {
        registered("u1");
        hub.stop();

        hub.start();

        assertTrue(hub.isRunning());
        assertEquals(0, hub.connectionCount().block(TIMEOUT));
        registered("u2");
        assertEquals(1, hub.connectionCount().block(TIMEOUT));
    }

    // ---------------------------------------------------------------------

    private Connection registered(String userId) {
        Connection connection = factory.create(userId);
        assertEquals(Boolean.TRUE, hub.register(connection).block(TIMEOUT));
        return connection;
    }

    private static List<Envelope> drain(Connection connection) {
        List<Envelope> received = new CopyOnWriteArrayList<>();
        connection.outbound().subscribe(received::add);
        return received;
    }

    private static List<String> types(List<Envelope> received) {
        return received.stream().map(Envelope::getType).collect(Collectors.toList());
    }

    private static List<String> contents(List<Envelope> received) {
        return received.stream()
            .filter(env -> env.getType().equals("chat_message"))
            .map(env -> env.getData().get("content").asText())
            .collect(Collectors.toList());
    }

    private static ObjectNode sessionData(String sessionId) {
        return JsonUtils.objectNode().put("sessionId", sessionId);
    }

    private static Envelope envelope(String type, String userId, ObjectNode data) {
        return Envelope.builder().type(type).userId(userId).data(data).build();
    }

    private static Envelope join(String userId, String sessionId) {
        return envelope("join_consultation", userId, sessionData(sessionId));
    }

    private static Envelope leave(String userId, String sessionId) {
        return envelope("leave_consultation", userId, sessionData(sessionId));
    }

    private static Envelope chat(String userId, String sessionId, String content) {
        return envelope("chat_message", userId, sessionData(sessionId).put("content", content));
    }

    private static Envelope chatPayload(String content) {
        return Envelope.builder()
            .type("chat_message")
            .data(JsonUtils.objectNode().put("content", content))
            .build();
    }
}
