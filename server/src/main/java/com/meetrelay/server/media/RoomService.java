package com.meetrelay.server.media;

import java.time.Duration;
import java.util.List;

/**
 * Management API of the external media service. Implementations report every
 * failure of the remote call as a {@link RoomServiceException}.
 */
public interface RoomService {

    RoomDescriptor createRoom(String name, int maxParticipants, String metadata);

    List<RoomDescriptor> listRooms();

    List<ParticipantDescriptor> getParticipants(String room);

    void deleteRoom(String name);

    /** Mutes or unmutes every audio track {@code identity} publishes in {@code room}. */
    void muteTrack(String room, String identity, boolean muted);

    void removeParticipant(String room, String identity);

    /**
     * Signs a join credential the media service accepts until {@code ttl} has elapsed.
     *
     * @param metadata optional participant metadata, may be null
     */
    String issueToken(String identity, String room, Grants grants, Duration ttl, String metadata);

    /** Address clients use to reach the media service. */
    String url();
}
