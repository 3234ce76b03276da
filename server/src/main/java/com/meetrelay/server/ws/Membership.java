package com.meetrelay.server.ws;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One registry entry, owned by the connection that created it. {@link #release()} is
 * idempotent and never evicts a newer connection for the same participant.
 */
public final class Membership {

    private final RoomRegistry registry;
    private final String roomId;
    private final String participantId;
    private final Connection connection;
    private final Connection superseded;
    private final AtomicBoolean released = new AtomicBoolean();

    Membership(RoomRegistry registry, String roomId, String participantId,
               Connection connection, Connection superseded) {
        this.registry = registry;
        this.roomId = roomId;
        this.participantId = participantId;
        this.connection = connection;
        this.superseded = superseded;
    }

    public String roomId() { return roomId; }

    public String participantId() { return participantId; }

    public Connection connection() { return connection; }

    /** The connection that held this (room, participant) slot before this registration. */
    public Optional<Connection> superseded() {
        return Optional.ofNullable(superseded);
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * @return true only for the single call that actually removed the entry
     */
    public boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        return registry.unregisterIfCurrent(roomId, participantId, connection);
    }

    @Override
    public String toString() {
        return "Membership[room=" + roomId + ", participant=" + participantId + ", " + connection + "]";
    }
}
