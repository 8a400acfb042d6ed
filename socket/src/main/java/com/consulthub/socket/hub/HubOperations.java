package com.consulthub.socket.hub;

import com.consulthub.core.msg.Envelope;

/**
 * Membership and fan-out primitives available to envelope handlers.
 * <p>
 * Implementations are not thread-safe; they are only called from the hub's coordinator thread.
 * </p>
 */
interface HubOperations {

    /**
     * Adds the user's most recent connection to a room.
     *
     * @return false if the user has no registered connection
     */
    boolean join(String userId, String sessionId);

    /**
     * Removes the user's most recent connection from a room.
     *
     * @return false if that connection was not a member
     */
    boolean leave(String userId, String sessionId);

    boolean isMember(String userId, String sessionId);

    /**
     * Stamps and enqueues an envelope to every room member, evicting members whose queue is full.
     *
     * @param excludeUserId user whose connections are skipped, or null to include everyone
     * @return number of members the envelope was enqueued to
     */
    int deliverToRoom(String sessionId, Envelope envelope, String excludeUserId);

    /**
     * Stamps and enqueues an envelope to the user's most recent connection only.
     *
     * @return false if the user has no connection or it was evicted
     */
    boolean reply(String userId, Envelope envelope);
}
