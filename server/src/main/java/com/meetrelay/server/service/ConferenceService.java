package com.meetrelay.server.service;

import com.meetrelay.server.media.Grants;
import com.meetrelay.server.media.ParticipantDescriptor;
import com.meetrelay.server.media.RoomDescriptor;
import com.meetrelay.server.media.RoomNotFoundException;
import com.meetrelay.server.media.RoomService;
import com.meetrelay.server.media.RoomServiceException;
import com.meetrelay.server.model.CreateRoomRequest;
import com.meetrelay.server.model.RoomInfo;
import com.meetrelay.server.model.TokenRequest;
import com.meetrelay.server.model.TokenResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Room and participant management on top of the media service. Every failure comes
 * back as a {@link RoomServiceException} whose message reads "Failed to &lt;action&gt;: &lt;cause&gt;".
 */
@Service
public class ConferenceService {
    private static final Logger log = LoggerFactory.getLogger(ConferenceService.class);

    static final Duration TOKEN_TTL = Duration.ofHours(24);
    static final int DEFAULT_TOKEN_ROOM_CAPACITY = 100;
    static final int DEFAULT_ROOM_CAPACITY = 50;

    private final RoomService roomService;

    public ConferenceService(RoomService roomService) {
        this.roomService = roomService;
    }

    /**
     * Creates the room when it does not exist yet, then signs a 24h credential with
     * join, publish, subscribe and publish-data grants.
     */
    public TokenResponse issueJoinToken(TokenRequest request) {
        log.info("[TOKEN] user={} room={}", request.participantName, request.roomName);
        int capacity = request.maxParticipants != null ? request.maxParticipants : DEFAULT_TOKEN_ROOM_CAPACITY;
        ensureRoomExists(request.roomName, capacity);

        String jwt = call("generate access token", () -> roomService.issueToken(
                request.participantName, request.roomName, Grants.full(), TOKEN_TTL, request.metadata));
        return new TokenResponse(jwt, roomService.url(), request.roomName, request.participantName);
    }

    /**
     * Best effort: a failed lookup or create is only logged, since a token for an
     * existing room stays usable.
     */
    void ensureRoomExists(String roomName, int maxParticipants) {
        try {
            boolean exists = roomService.listRooms().stream().anyMatch(r -> r.name().equals(roomName));
            if (exists) {
                log.debug("[TOKEN] room={} already exists", roomName);
                return;
            }
            roomService.createRoom(roomName, maxParticipants, "");
            log.info("[TOKEN] auto-created room={} max={}", roomName, maxParticipants);
        } catch (RoomServiceException e) {
            log.error("[ERROR] ensuring room {} exists: {}", roomName, e.getMessage());
        }
    }

    public RoomDescriptor createRoom(CreateRoomRequest request) {
        int capacity = request.maxParticipants != null ? request.maxParticipants : DEFAULT_ROOM_CAPACITY;
        log.info("[ROOM] creating room={}", request.roomName);
        return call("create room", () -> roomService.createRoom(
                request.roomName, capacity, request.metadata == null ? "" : request.metadata));
    }

    public List<RoomDescriptor> listRooms() {
        return call("list rooms", roomService::listRooms);
    }

    public RoomInfo getRoom(String roomName) {
        RoomDescriptor room = call("get room information", () -> roomService.listRooms().stream()
                .filter(r -> r.name().equals(roomName))
                .findFirst()
                .orElseThrow(() -> new RoomNotFoundException(roomName)));
        List<String> names = call("get room information", () -> roomService.getParticipants(roomName)).stream()
                .map(ParticipantDescriptor::name)
                .collect(Collectors.toList());
        return new RoomInfo(room.name(), room.numParticipants(), names, room.creationTime(), room.metadata());
    }

    public List<ParticipantDescriptor> getParticipants(String roomName) {
        return call("get room participants", () -> roomService.getParticipants(roomName));
    }

    public void deleteRoom(String roomName) {
        call("delete room", () -> {
            roomService.deleteRoom(roomName);
            return null;
        });
        log.info("[ROOM] deleted room={}", roomName);
    }

    public void setMuted(String roomName, String identity, boolean muted) {
        call(muted ? "mute participant" : "unmute participant", () -> {
            roomService.muteTrack(roomName, identity, muted);
            return null;
        });
    }

    public void removeParticipant(String roomName, String identity) {
        call("remove participant", () -> {
            roomService.removeParticipant(roomName, identity);
            return null;
        });
    }

    public boolean isConfigured() {
        String url = roomService.url();
        return url != null && !url.isBlank();
    }

    private static <T> T call(String action, Supplier<T> body) {
        try {
            return body.get();
        } catch (RoomServiceException e) {
            log.error("[ERROR] {} failed: {}", action, e.getMessage());
            throw new RoomServiceException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }
}
