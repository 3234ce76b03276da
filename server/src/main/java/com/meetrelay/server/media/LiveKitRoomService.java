package com.meetrelay.server.media;

import io.livekit.server.AccessToken;
import io.livekit.server.CanPublish;
import io.livekit.server.CanPublishData;
import io.livekit.server.CanSubscribe;
import io.livekit.server.RoomJoin;
import io.livekit.server.RoomName;
import io.livekit.server.RoomServiceClient;
import livekit.LivekitModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link RoomService} backed by the LiveKit server SDK.
 */
public class LiveKitRoomService implements RoomService {
    private static final Logger log = LoggerFactory.getLogger(LiveKitRoomService.class);

    private final RoomServiceClient client;
    private final String url;
    private final String apiKey;
    private final String apiSecret;

    public LiveKitRoomService(RoomServiceClient client, String url, String apiKey, String apiSecret) {
        this.client = client;
        this.url = url;
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
    }

    @Override
    public RoomDescriptor createRoom(String name, int maxParticipants, String metadata) {
        LivekitModels.Room room = execute(
                client.createRoom(name, null, maxParticipants, null, metadata == null ? "" : metadata),
                "create room " + name);
        log.info("[LIVEKIT] created room={} sid={} max={}", room.getName(), room.getSid(), room.getMaxParticipants());
        return toDescriptor(room);
    }

    @Override
    public List<RoomDescriptor> listRooms() {
        List<LivekitModels.Room> rooms = execute(client.listRooms(null), "list rooms");
        return rooms.stream().map(LiveKitRoomService::toDescriptor).collect(Collectors.toList());
    }

    @Override
    public List<ParticipantDescriptor> getParticipants(String room) {
        List<LivekitModels.ParticipantInfo> participants =
                execute(client.listParticipants(room), "list participants of " + room);
        return participants.stream().map(LiveKitRoomService::toDescriptor).collect(Collectors.toList());
    }

    @Override
    public void deleteRoom(String name) {
        execute(client.deleteRoom(name), "delete room " + name);
        log.info("[LIVEKIT] deleted room={}", name);
    }

    @Override
    public void muteTrack(String room, String identity, boolean muted) {
        LivekitModels.ParticipantInfo participant =
                execute(client.getParticipant(room, identity), "look up " + identity + " in " + room);
        int n = 0;
        for (LivekitModels.TrackInfo track : participant.getTracksList()) {
            if (track.getType() != LivekitModels.TrackType.AUDIO) continue;
            execute(client.mutePublishedTrack(room, identity, track.getSid(), muted),
                    (muted ? "mute " : "unmute ") + track.getSid());
            n++;
        }
        log.info("[LIVEKIT] room={} identity={} muted={} tracks={}", room, identity, muted, n);
    }

    @Override
    public void removeParticipant(String room, String identity) {
        execute(client.removeParticipant(room, identity), "remove " + identity + " from " + room);
        log.info("[LIVEKIT] removed identity={} room={}", identity, room);
    }

    @Override
    public String issueToken(String identity, String room, Grants grants, Duration ttl, String metadata) {
        AccessToken token = new AccessToken(apiKey, apiSecret);
        token.setIdentity(identity);
        token.setName(identity);
        token.setTtl(ttl.toMillis());
        if (metadata != null && !metadata.isEmpty()) {
            token.setMetadata(metadata);
        }
        token.addGrants(
                new RoomJoin(grants.roomJoin()),
                new RoomName(room),
                new CanPublish(grants.canPublish()),
                new CanSubscribe(grants.canSubscribe()),
                new CanPublishData(grants.canPublishData()));
        return token.toJwt();
    }

    @Override
    public String url() {
        return url;
    }

    private static <T> T execute(Call<T> call, String action) {
        Response<T> response;
        try {
            response = call.execute();
        } catch (IOException | RuntimeException e) {
            throw new RoomServiceException("could not " + action + ": " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw new RoomServiceException("could not " + action + ": HTTP " + response.code() + " " + response.message());
        }
        return response.body();
    }

    static RoomDescriptor toDescriptor(LivekitModels.Room room) {
        return new RoomDescriptor(
                room.getName(),
                room.getSid(),
                room.getNumParticipants(),
                room.getMaxParticipants(),
                room.getCreationTime(),
                room.getMetadata());
    }

    static ParticipantDescriptor toDescriptor(LivekitModels.ParticipantInfo p) {
        LivekitModels.ParticipantPermission perm = p.getPermission();
        return new ParticipantDescriptor(
                p.getIdentity(),
                p.getName(),
                p.getSid(),
                p.getState().name(),
                p.getJoinedAt(),
                p.getMetadata(),
                new ParticipantDescriptor.Permission(
                        perm.getCanPublish(), perm.getCanSubscribe(), perm.getCanPublishData()));
    }
}
