package com.consulthub.socket.session;

import com.consulthub.core.msg.Envelope;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live duplex channel: identity, bounded outbound queue and joined rooms.
 * <p>
 * The hub is the only producer of the queue and the connection's write loop is its only
 * consumer. The joined-rooms set is mutated by the hub only, together with the room table.
 * </p>
 */
public class Connection {
    @Getter
    private final String id;
    @Getter
    private final String userId;
    @Getter
    private final int queueCapacity;

    private final Sinks.Many<Envelope> queue;
    private final Sinks.Empty<Void> closeSignal = Sinks.empty();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<String> joinedRooms = ConcurrentHashMap.newKeySet();

    public Connection(String id, String userId, int queueCapacity, Sinks.Many<Envelope> queue) {
        this.id = id;
        this.userId = userId;
        this.queueCapacity = queueCapacity;
        this.queue = queue;
    }

    /**
     * Enqueues an envelope without blocking.
     *
     * @param envelope envelope to deliver
     * @return false if the queue is full or already closed
     */
    public boolean offer(Envelope envelope) {
        if (closed.get()) {
            return false;
        }
        return queue.tryEmitNext(envelope).isSuccess();
    }

    /**
     * Closes the queue and signals both loops to unwind. Idempotent.
     *
     * @return true if this call closed the connection
     */
    public boolean close() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        queue.tryEmitComplete();
        closeSignal.tryEmitEmpty();
        return true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Queued envelopes, in enqueue order. Only one subscriber (the write loop) is allowed.
     */
    public Flux<Envelope> outbound() {
        return queue.asFlux();
    }

    /**
     * Completes when {@link #close()} is called.
     */
    public Mono<Void> onClose() {
        return closeSignal.asMono();
    }

    public Set<String> getJoinedRooms() {
        return Collections.unmodifiableSet(joinedRooms);
    }

    void addRoom(String sessionId) {
        joinedRooms.add(sessionId);
    }

    void removeRoom(String sessionId) {
        joinedRooms.remove(sessionId);
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", userId=" + userId + "}";
    }
}
