package com.consulthub.socket.hub;

import com.consulthub.core.msg.Envelope;
import com.consulthub.socket.session.Connection;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Interface for the hub coordinator.
 * <p>
 * Sole authority over membership and routing. All operations are processed one at a time in
 * submission order; each returned {@link Mono} completes once its operation has been applied.
 * </p>
 */
public interface IHub {

    /**
     * Registers a connection and enqueues a {@code connection_confirmed} envelope to it.
     *
     * @param connection Freshly created connection
     * @return Mono of true if registered, false if it was dropped (closed or confirmation not enqueued)
     */
    Mono<Boolean> register(Connection connection);

    /**
     * Removes a connection from the global set and from every room, closing its queue.
     * Idempotent.
     *
     * @param connection Connection to remove
     * @return Mono of true if the connection was registered before this call
     */
    Mono<Boolean> unregister(Connection connection);

    /**
     * Routes an inbound envelope to its handler. Unknown types are logged and dropped.
     *
     * @param envelope Envelope with {@code user_id} set from the authenticated identity
     * @return Mono completing when the envelope has been processed
     */
    Mono<Void> dispatch(Envelope envelope);

    /**
     * Adds the user's most recent connection to a room, creating the room if needed.
     *
     * @return Mono of false if the user has no registered connection
     */
    Mono<Boolean> joinRoom(String userId, String sessionId);

    /**
     * Removes the user's most recent connection from a room, deleting the room if now empty.
     *
     * @return Mono of false if that connection was not a member
     */
    Mono<Boolean> leaveRoom(String userId, String sessionId);

    /**
     * Stamps {@code timestamp} and {@code session_id} and enqueues to every member.
     * Members whose queue is full are evicted.
     *
     * @return Mono of the number of members the envelope was enqueued to
     */
    Mono<Integer> broadcastToRoom(String sessionId, Envelope envelope);

    /**
     * Stamps {@code timestamp} and enqueues to every connection of a user, with the same
     * eviction policy as room broadcasts.
     *
     * @return Mono of the number of connections the envelope was enqueued to
     */
    Mono<Integer> broadcastToUser(String userId, Envelope envelope);

    /**
     * Number of members currently in a room (0 if the room does not exist).
     */
    Mono<Integer> roomParticipants(String sessionId);

    /**
     * Number of distinct users with at least one registered connection.
     */
    Mono<Integer> connectedUsers();

    Mono<Integer> connectionCount();

    Mono<Integer> roomCount();

    /**
     * Rooms the connection is currently a member of (empty once it is unregistered).
     */
    Mono<Set<String>> roomsOf(Connection connection);

    /**
     * Consistent view of connections and rooms.
     */
    Mono<HubSnapshot> snapshot();
}
