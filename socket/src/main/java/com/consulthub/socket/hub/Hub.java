package com.consulthub.socket.hub;

import com.consulthub.core.msg.Envelope;
import com.consulthub.core.msg.MessageType;
import com.consulthub.core.util.JsonUtils;
import com.consulthub.socket.metrics.MetricsService;
import com.consulthub.socket.metrics.MetricsService.EvictionReason;
import com.consulthub.socket.session.Connection;
import com.consulthub.socket.session.RoomTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hub coordinator: the single writer of membership state and the single point of ordering
 * for all mutations and broadcasts.
 * <p>
 * <b>Serialization:</b> every operation is submitted to one single-threaded scheduler and runs
 * to completion before the next starts. The scheduler's task queue is the hub's intake. Because
 * registration, removal and broadcast never interleave, a broadcast sees either all or none of a
 * concurrent registration, and all members of a room observe broadcasts in the same order.
 * </p>
 * <p>
 * <b>Backpressure:</b> fan-out never blocks. A member whose outbound queue is full is evicted
 * (queue closed, removed from the global set and every room) and delivery to the others continues.
 * </p>
 * <p>
 * <b>Lifecycle:</b> {@link #start()} creates the coordinator, {@link #stop()} closes every
 * connection and disposes it. Operations submitted while the hub is not running fail with
 * {@link IllegalStateException}.
 * </p>
 */
public class Hub implements IHub {
    private static final Logger log = LoggerFactory.getLogger(Hub.class);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final MetricsService metricsService;
    private final Clock clock;
    private final MessageRouter router;

    // Coordinator-owned state: never touched outside the coordinator thread
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, Connection> latestByUser = new HashMap<>();
    private final RoomTable rooms = new RoomTable();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Scheduler coordinator;

    public Hub(MetricsService metricsService) {
        this(metricsService, Clock.systemUTC());
    }

    public Hub(MetricsService metricsService, Clock clock) {
        this.metricsService = metricsService;
        this.clock = clock;
        this.router = new MessageRouter(new CoordinatorOperations());
    }

    /**
     * Starts the coordinator. Calling it on a running hub is a no-op.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        coordinator = Schedulers.newSingle("hub-coordinator");
        log.info("Hub coordinator started");
    }

    /**
     * Closes every connection, clears membership and disposes the coordinator.
     * Operations already queued are processed first.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Scheduler scheduler = coordinator;
        try {
            Mono.fromRunnable(this::closeAll)
                .subscribeOn(scheduler)
                .block(STOP_TIMEOUT);
        } finally {
            coordinator = null;
            scheduler.dispose();
        }
        log.info("Hub coordinator stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public Mono<Boolean> register(Connection connection) {
        return submit(() -> doRegister(connection));
    }

    @Override
    public Mono<Boolean> unregister(Connection connection) {
        return submit(() -> doUnregister(connection));
    }

    @Override
    public Mono<Void> dispatch(Envelope envelope) {
        return submit(() -> {
            metricsService.recordInboundEnvelope(envelope.messageType().map(MessageType::getWireName).orElse(null));
            try {
                router.route(envelope);
            } catch (RuntimeException e) {
                // A failing handler must never take the coordinator down
                log.error("Handler for '{}' from {} failed", envelope.getType(), envelope.getUserId(), e);
            }
            return null;
        }).then();
    }

    @Override
    public Mono<Boolean> joinRoom(String userId, String sessionId) {
        return submit(() -> doJoin(userId, sessionId));
    }

    @Override
    public Mono<Boolean> leaveRoom(String userId, String sessionId) {
        return submit(() -> doLeave(userId, sessionId));
    }

    @Override
    public Mono<Integer> broadcastToRoom(String sessionId, Envelope envelope) {
        return submit(() -> doBroadcastToRoom(sessionId, envelope, null));
    }

    @Override
    public Mono<Integer> broadcastToUser(String userId, Envelope envelope) {
        return submit(() -> doBroadcastToUser(userId, envelope));
    }

    @Override
    public Mono<Integer> roomParticipants(String sessionId) {
        return submit(() -> rooms.size(sessionId));
    }

    @Override
    public Mono<Integer> connectedUsers() {
        return submit(latestByUser::size);
    }

    @Override
    public Mono<Integer> connectionCount() {
        return submit(connections::size);
    }

    @Override
    public Mono<Integer> roomCount() {
        return submit(rooms::roomCount);
    }

    @Override
    public Mono<Set<String>> roomsOf(Connection connection) {
        return submit(() -> Set.copyOf(connection.getJoinedRooms()));
    }

    @Override
    public Mono<HubSnapshot> snapshot() {
        return submit(this::doSnapshot);
    }

    private <T> Mono<T> submit(Callable<T> operation) {
        return Mono.defer(() -> {
            Scheduler scheduler = coordinator;
            if (!running.get() || scheduler == null) {
                return Mono.error(new IllegalStateException("Hub is not running"));
            }
            return Mono.fromCallable(operation).subscribeOn(scheduler);
        });
    }

    // ---------------------------------------------------------------------
    // Coordinator-thread operations
    // ---------------------------------------------------------------------

    private boolean doRegister(Connection connection) {
        if (connection.isClosed()) {
            // Channel went away before registration was processed
            log.debug("Skipping registration of closed connection {}", connection.getId());
            return false;
        }

        connections.put(connection.getId(), connection);
        latestByUser.put(connection.getUserId(), connection);
        metricsService.recordConnectionRegistered();
        updateGauges();

        Envelope confirmation = Envelope.builder()
            .type(MessageType.CONNECTION_CONFIRMED.getWireName())
            .data(JsonUtils.objectNode()
                .put("status", "connected")
                .put("connectionId", connection.getId()))
            .timestamp(clock.millis())
            .build();

        if (!connection.offer(confirmation)) {
            log.warn("Could not enqueue confirmation for {}, dropping connection", connection);
            evict(connection, EvictionReason.QUEUE_FULL);
            return false;
        }

        log.info("Client {} connected (user {})", connection.getId(), connection.getUserId());
        return true;
    }

    private boolean doUnregister(Connection connection) {
        Connection removed = connections.remove(connection.getId());
        connection.close();
        if (removed == null) {
            return false;
        }

        List<String> deletedRooms = rooms.leaveAll(connection);
        replaceLatest(connection);
        updateGauges();

        log.info("Client {} disconnected (user {})", connection.getId(), connection.getUserId());
        if (!deletedRooms.isEmpty()) {
            log.debug("Rooms {} deleted after last member left", deletedRooms);
        }
        return true;
    }

    private void evict(Connection connection, EvictionReason reason) {
        log.warn("Evicting {} ({})", connection, reason);
        metricsService.recordEviction(reason);
        doUnregister(connection);
    }

    /**
     * Points the user's "most recent connection" at the newest remaining one, if any.
     */
    private void replaceLatest(Connection removed) {
        String userId = removed.getUserId();
        if (latestByUser.get(userId) != removed) {
            return;
        }
        Connection newest = null;
        for (Connection candidate : connections.values()) {
            if (candidate.getUserId().equals(userId)) {
                newest = candidate;
            }
        }
        if (newest == null) {
            latestByUser.remove(userId);
        } else {
            latestByUser.put(userId, newest);
        }
    }

    private boolean doJoin(String userId, String sessionId) {
        Connection connection = latestByUser.get(userId);
        if (connection == null) {
            log.debug("Join of {} ignored: user {} has no connection", sessionId, userId);
            return false;
        }
        rooms.join(sessionId, connection);
        updateGauges();
        log.info("Client {} joined consultation {}", connection.getId(), sessionId);
        return true;
    }

    private boolean doLeave(String userId, String sessionId) {
        Connection connection = latestByUser.get(userId);
        if (connection == null || !rooms.leave(sessionId, connection)) {
            return false;
        }
        updateGauges();
        log.info("Client {} left consultation {}", connection.getId(), sessionId);
        return true;
    }

    private boolean isMember(String userId, String sessionId) {
        Connection connection = latestByUser.get(userId);
        return connection != null && rooms.isMember(sessionId, connection);
    }

    private int doBroadcastToRoom(String sessionId, Envelope envelope, String excludeUserId) {
        List<Connection> members = rooms.members(sessionId);
        if (members.isEmpty()) {
            log.debug("Broadcast to {} skipped: room does not exist", sessionId);
            return 0;
        }

        Envelope stamped = envelope.withTimestamp(clock.millis()).withSessionId(sessionId);
        int delivered = deliverAll(members, stamped, excludeUserId);
        metricsService.recordBroadcastFanout(delivered);
        return delivered;
    }

    private int doBroadcastToUser(String userId, Envelope envelope) {
        List<Connection> targets = new ArrayList<>();
        for (Connection connection : connections.values()) {
            if (connection.getUserId().equals(userId)) {
                targets.add(connection);
            }
        }
        return deliverAll(targets, envelope.withTimestamp(clock.millis()), null);
    }

    private boolean doReply(String userId, Envelope envelope) {
        Connection connection = latestByUser.get(userId);
        if (connection == null) {
            return false;
        }
        return deliverAll(List.of(connection), envelope.withTimestamp(clock.millis()), null) == 1;
    }

    /**
     * Enqueues to each target; targets that cannot accept are evicted after the pass.
     */
    private int deliverAll(List<Connection> targets, Envelope envelope, String excludeUserId) {
        int delivered = 0;
        List<Connection> overflowed = new ArrayList<>();
        for (Connection target : targets) {
            if (excludeUserId != null && excludeUserId.equals(target.getUserId())) {
                continue;
            }
            if (target.offer(envelope)) {
                delivered++;
            } else {
                overflowed.add(target);
            }
        }
        for (Connection target : overflowed) {
            if (target.isClosed()) {
                // Already torn down, its unregistration is still in the intake
                doUnregister(target);
            } else {
                evict(target, EvictionReason.QUEUE_FULL);
            }
        }
        return delivered;
    }

    private HubSnapshot doSnapshot() {
        Map<String, List<String>> roomView = new LinkedHashMap<>();
        for (String sessionId : rooms.roomIds()) {
            roomView.put(sessionId, rooms.members(sessionId).stream().map(Connection::getId).toList());
        }
        return HubSnapshot.builder()
            .connectionIds(List.copyOf(connections.keySet()))
            .connectedUsers(latestByUser.size())
            .rooms(Map.copyOf(roomView))
            .build();
    }

    private void closeAll() {
        log.info("Closing {} connections", connections.size());
        connections.values().forEach(Connection::close);
        connections.clear();
        latestByUser.clear();
        rooms.clear();
        updateGauges();
    }

    private void updateGauges() {
        metricsService.setActiveConnections(connections.size());
        metricsService.setActiveRooms(rooms.roomCount());
    }

    /**
     * Handler-facing view of the coordinator state.
     */
    private final class CoordinatorOperations implements HubOperations {
        @Override
        public boolean join(String userId, String sessionId) {
            return doJoin(userId, sessionId);
        }

        @Override
        public boolean leave(String userId, String sessionId) {
            return doLeave(userId, sessionId);
        }

        @Override
        public boolean isMember(String userId, String sessionId) {
            return Hub.this.isMember(userId, sessionId);
        }

        @Override
        public int deliverToRoom(String sessionId, Envelope envelope, String excludeUserId) {
            return doBroadcastToRoom(sessionId, envelope, excludeUserId);
        }

        @Override
        public boolean reply(String userId, Envelope envelope) {
            return doReply(userId, envelope);
        }
    }
}
