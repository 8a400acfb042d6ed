package com.consulthub.socket.hub;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the hub's membership state, taken on the coordinator.
 */
@Value
@Builder
public class HubSnapshot {
    /**
     * Registered connection ids, in registration order.
     */
    List<String> connectionIds;

    /**
     * Number of distinct users with at least one registered connection.
     */
    int connectedUsers;

    /**
     * Session id to member connection ids, in join order.
     */
    Map<String, List<String>> rooms;

    public int getConnectionCount() {
        return connectionIds.size();
    }

    public int getRoomCount() {
        return rooms.size();
    }
}
