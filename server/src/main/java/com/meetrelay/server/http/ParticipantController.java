package com.meetrelay.server.http;

import com.meetrelay.server.media.ParticipantDescriptor;
import com.meetrelay.server.model.TokenRequest;
import com.meetrelay.server.model.TokenResponse;
import com.meetrelay.server.service.ConferenceService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Join tokens and per-participant moderation.
 */
@RestController
@RequestMapping("/api/livekit")
public class ParticipantController {

    private final ConferenceService conferenceService;

    public ParticipantController(ConferenceService conferenceService) {
        this.conferenceService = conferenceService;
    }

    @PostMapping("/token")
    public ResponseEntity<TokenResponse> token(@Valid @RequestBody TokenRequest request) {
        return ResponseEntity.ok(conferenceService.issueJoinToken(request));
    }

    @GetMapping("/room/{roomName}/participants")
    public ResponseEntity<Map<String, Object>> participants(@PathVariable String roomName) {
        List<ParticipantDescriptor> participants = conferenceService.getParticipants(roomName);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roomName", roomName);
        body.put("participants", participants);
        body.put("total", participants.size());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/room/{roomName}/mute/{identity}")
    public ResponseEntity<Map<String, Object>> mute(@PathVariable String roomName, @PathVariable String identity) {
        conferenceService.setMuted(roomName, identity, true);
        return ResponseEntity.ok(outcome(roomName, identity, "muted"));
    }

    @PostMapping("/room/{roomName}/unmute/{identity}")
    public ResponseEntity<Map<String, Object>> unmute(@PathVariable String roomName, @PathVariable String identity) {
        conferenceService.setMuted(roomName, identity, false);
        return ResponseEntity.ok(outcome(roomName, identity, "unmuted"));
    }

    @PostMapping("/room/{roomName}/kick/{identity}")
    public ResponseEntity<Map<String, Object>> kick(@PathVariable String roomName, @PathVariable String identity) {
        conferenceService.removeParticipant(roomName, identity);
        return ResponseEntity.ok(outcome(roomName, identity, "removed"));
    }

    private static Map<String, Object> outcome(String roomName, String identity, String status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roomName", roomName);
        body.put("participantIdentity", identity);
        body.put("status", status);
        return body;
    }
}
