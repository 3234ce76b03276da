package com.meetrelay.server.ws;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Room id to (participant id to {@link Connection}). Member maps are immutable and
 * swapped inside {@link ConcurrentMap#compute}; empty rooms are dropped.
 */
@Component
public class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentMap<String, Map<String, Connection>> rooms = new ConcurrentHashMap<>();

    /** Replaces any existing entry; the old connection comes back open in {@link Membership#superseded()}. */
    public Membership register(String roomId, String participantId, Connection connection) {
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(connection, "connection");

        Connection[] previous = new Connection[1];
        rooms.compute(roomId, (k, members) -> {
            Map<String, Connection> next = members == null ? new LinkedHashMap<>() : new LinkedHashMap<>(members);
            previous[0] = next.put(participantId, connection);
            return Collections.unmodifiableMap(next);
        });

        Connection superseded = previous[0] == connection ? null : previous[0];
        return new Membership(this, roomId, participantId, connection, superseded);
    }

    /** Removes whatever is registered under (room, participant). Absent entries are not an error. */
    public boolean unregister(String roomId, String participantId) {
        return remove(roomId, participantId, null);
    }

    /** Removes the entry only while it still maps to {@code expected}. */
    boolean unregisterIfCurrent(String roomId, String participantId, Connection expected) {
        return remove(roomId, participantId, Objects.requireNonNull(expected, "expected"));
    }

    private boolean remove(String roomId, String participantId, Connection expected) {
        boolean[] removed = new boolean[1];
        rooms.computeIfPresent(roomId, (k, members) -> {
            Connection current = members.get(participantId);
            if (current == null || (expected != null && current != expected)) {
                return members;
            }
            Map<String, Connection> next = new LinkedHashMap<>(members);
            next.remove(participantId);
            removed[0] = true;
            return next.isEmpty() ? null : Collections.unmodifiableMap(next);
        });
        return removed[0];
    }

    public Optional<Connection> lookup(String roomId, String participantId) {
        if (roomId == null || participantId == null) return Optional.empty();
        return Optional.ofNullable(snapshot(roomId).get(participantId));
    }

    public Set<String> members(String roomId) {
        return snapshot(roomId).keySet();
    }

    /** Point-in-time, unmodifiable view of a room; empty for unknown rooms. */
    public Map<String, Connection> snapshot(String roomId) {
        Map<String, Connection> members = rooms.get(roomId);
        return members != null ? members : Map.of();
    }

    public Set<String> roomIds() {
        return Set.copyOf(rooms.keySet());
    }

    /** Total number of registered connections across all rooms. */
    public int size() {
        int total = 0;
        for (Map<String, Connection> members : rooms.values()) {
            total += members.size();
        }
        return total;
    }

    /**
     * Empties the registry, then closes every connection it held. Entries are gone
     * before the closes land, so no leave notifications go out.
     */
    public void closeAll(CloseStatus status) {
        List<Connection> all = new ArrayList<>();
        for (String roomId : roomIds()) {
            Map<String, Connection> members = rooms.remove(roomId);
            if (members != null) all.addAll(members.values());
        }
        for (Connection c : all) {
            c.close(status);
        }
        log.info("[SHUTDOWN] closed={}", all.size());
    }

    @PreDestroy
    public void shutdown() {
        closeAll(CloseStatus.GOING_AWAY);
    }
}
