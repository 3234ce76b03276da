package com.meetrelay.server.http;

import com.meetrelay.server.media.Grants;
import com.meetrelay.server.media.ParticipantDescriptor;
import com.meetrelay.server.media.RoomDescriptor;
import com.meetrelay.server.media.RoomService;
import com.meetrelay.server.media.RoomServiceException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ConferenceApiTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private RoomService roomService;

    @Test
    void tokenIsIssuedForRoomAndParticipant() throws Exception {
        when(roomService.listRooms()).thenReturn(List.of());
        when(roomService.issueToken("alice", "demo", Grants.full(), Duration.ofHours(24), null)).thenReturn("signed.jwt.value");
        when(roomService.url()).thenReturn("ws://localhost:7880");

        mvc.perform(post("/api/livekit/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roomName\":\"demo\",\"participantName\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("signed.jwt.value"))
                .andExpect(jsonPath("$.wsUrl").value("ws://localhost:7880"))
                .andExpect(jsonPath("$.roomName").value("demo"))
                .andExpect(jsonPath("$.participantName").value("alice"));
    }

    @Test
    void tokenWithoutParticipantIsRejected() throws Exception {
        mvc.perform(post("/api/livekit/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roomName\":\"demo\",\"participantName\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").exists());
    }

    @Test
    void roomIsCreated() throws Exception {
        when(roomService.createRoom("standup", 12, "daily"))
                .thenReturn(new RoomDescriptor("standup", "RM_9", 0, 12, 1_700_000_000L, "daily"));

        mvc.perform(post("/api/livekit/room")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roomName\":\"standup\",\"maxParticipants\":12,\"metadata\":\"daily\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomName").value("standup"))
                .andExpect(jsonPath("$.sid").value("RM_9"))
                .andExpect(jsonPath("$.maxParticipants").value(12))
                .andExpect(jsonPath("$.status").value("created"));
    }

    @Test
    void roomsAreListed() throws Exception {
        when(roomService.listRooms()).thenReturn(List.of(
                new RoomDescriptor("a", "RM_A", 2, 50, 1L, ""),
                new RoomDescriptor("b", "RM_B", 0, 50, 2L, "")));

        mvc.perform(get("/api/livekit/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.rooms[0].name").value("a"))
                .andExpect(jsonPath("$.rooms[0].numParticipants").value(2));
    }

    @Test
    void unknownRoomIsNotFound() throws Exception {
        when(roomService.listRooms()).thenReturn(List.of());

        mvc.perform(get("/api/livekit/room/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Room 'ghost' not found"));
    }

    @Test
    void participantsAreListedWithPermissions() throws Exception {
        when(roomService.getParticipants("demo")).thenReturn(List.of(
                new ParticipantDescriptor("alice", "Alice", "PA_1", "ACTIVE", 5L, "",
                        new ParticipantDescriptor.Permission(true, true, false))));

        mvc.perform(get("/api/livekit/room/demo/participants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomName").value("demo"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.participants[0].identity").value("alice"))
                .andExpect(jsonPath("$.participants[0].permission.canPublishData").value(false));
    }

    @Test
    void roomIsDeleted() throws Exception {
        mvc.perform(delete("/api/livekit/room/demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"))
                .andExpect(jsonPath("$.message").value("Room 'demo' has been deleted"));

        verify(roomService).deleteRoom("demo");
    }

    @Test
    void participantIsMutedAndUnmuted() throws Exception {
        mvc.perform(post("/api/livekit/room/demo/mute/bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.participantIdentity").value("bob"))
                .andExpect(jsonPath("$.status").value("muted"));
        mvc.perform(post("/api/livekit/room/demo/unmute/bob"))
                .andExpect(jsonPath("$.status").value("unmuted"));

        verify(roomService).muteTrack("demo", "bob", true);
        verify(roomService).muteTrack("demo", "bob", false);
    }

    @Test
    void kickFailureIsReportedAsServerError() throws Exception {
        doThrow(new RoomServiceException("HTTP 503")).when(roomService).removeParticipant(anyString(), anyString());

        mvc.perform(post("/api/livekit/room/demo/kick/bob"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Failed to remove participant: HTTP 503"));
    }

    @Test
    void createRoomFailureIsReportedAsServerError() throws Exception {
        when(roomService.createRoom(anyString(), anyInt(), anyString())).thenThrow(new RoomServiceException("down"));

        mvc.perform(post("/api/livekit/room")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roomName\":\"demo\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Failed to create room: down"));
    }

    @Test
    void healthReportsConfiguration() throws Exception {
        when(roomService.url()).thenReturn("ws://localhost:7880");

        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.livekit_configured").value(true));
    }

    @Test
    void rootListsEndpoints() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.endpoints.generate_token").value("/api/livekit/token"));
    }

    @Test
    void unknownEndpointGetsJsonNotFound() throws Exception {
        mvc.perform(get("/api/nothing-here"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Endpoint not found"))
                .andExpect(jsonPath("$.available_endpoints").isArray());
    }

    @Test
    void signalingMembersOfUnknownRoomAreEmpty() throws Exception {
        mvc.perform(get("/api/signaling/rooms/nobody-here/members"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomId").value("nobody-here"))
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void crossOriginPreflightForTokenIsAllowed() throws Exception {
        mvc.perform(options("/api/livekit/token")
                        .header(HttpHeaders.ORIGIN, "http://frontend.example:3000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "content-type"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://frontend.example:3000"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));
    }

    @Test
    void crossOriginHealthCheckCarriesAllowOrigin() throws Exception {
        mvc.perform(get("/health").header(HttpHeaders.ORIGIN, "http://frontend.example:3000"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://frontend.example:3000"));
    }
}
