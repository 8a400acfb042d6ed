package com.consulthub.socket.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Room membership table: session id to member connections.
 * <p>
 * Not thread-safe. Owned by the hub and touched only from its coordinator thread.
 * Every mutation updates the connection's joined-rooms set in the same call, so that
 * {@code m in members(R)} holds exactly when {@code R in m.joinedRooms}. A room is removed
 * as soon as its last member leaves.
 * </p>
 */
public class RoomTable {

    private final Map<String, Set<Connection>> rooms = new HashMap<>();

    /**
     * Adds a connection to a room, creating the room if needed.
     *
     * @return true if the connection was not a member yet
     */
    public boolean join(String sessionId, Connection connection) {
        boolean added = rooms.computeIfAbsent(sessionId, k -> new LinkedHashSet<>()).add(connection);
        connection.addRoom(sessionId);
        return added;
    }

    /**
     * Removes a connection from a room, deleting the room if it became empty.
     *
     * @return true if the connection was a member
     */
    public boolean leave(String sessionId, Connection connection) {
        connection.removeRoom(sessionId);
        Set<Connection> members = rooms.get(sessionId);
        if (members == null) {
            return false;
        }
        boolean removed = members.remove(connection);
        if (members.isEmpty()) {
            rooms.remove(sessionId);
        }
        return removed;
    }

    /**
     * Removes a connection from every room it joined.
     *
     * @return ids of the rooms deleted because they became empty
     */
    public List<String> leaveAll(Connection connection) {
        List<String> deleted = new ArrayList<>();
        for (String sessionId : List.copyOf(connection.getJoinedRooms())) {
            leave(sessionId, connection);
            if (!rooms.containsKey(sessionId)) {
                deleted.add(sessionId);
            }
        }
        return deleted;
    }

    public boolean isMember(String sessionId, Connection connection) {
        Set<Connection> members = rooms.get(sessionId);
        return members != null && members.contains(connection);
    }

    /**
     * Snapshot of a room's members in join order.
     */
    public List<Connection> members(String sessionId) {
        Set<Connection> members = rooms.get(sessionId);
        return members == null ? List.of() : List.copyOf(members);
    }

    public int size(String sessionId) {
        Set<Connection> members = rooms.get(sessionId);
        return members == null ? 0 : members.size();
    }

    public int roomCount() {
        return rooms.size();
    }

    public Set<String> roomIds() {
        return Collections.unmodifiableSet(rooms.keySet());
    }

    public void clear() {
        for (Set<Connection> members : rooms.values()) {
            for (Connection connection : members) {
                List.copyOf(connection.getJoinedRooms()).forEach(connection::removeRoom);
            }
        }
        rooms.clear();
    }
}
