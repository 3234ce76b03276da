package com.meetrelay.server.http;

import com.meetrelay.server.service.ConferenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class StatusController {

    static final List<String> ENDPOINTS = List.of(
            "/api/livekit/token",
            "/api/livekit/room",
            "/api/livekit/rooms",
            "/api/livekit/room/{room_name}",
            "/api/livekit/room/{room_name}/participants",
            "/api/signaling/rooms",
            "/ws/{room_id}/{user_id}",
            "/health");

    private final ConferenceService conferenceService;

    public StatusController(ConferenceService conferenceService) {
        this.conferenceService = conferenceService;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("generate_token", "/api/livekit/token");
        endpoints.put("create_room", "/api/livekit/room");
        endpoints.put("list_rooms", "/api/livekit/rooms");
        endpoints.put("room_info", "/api/livekit/room/{room_name}");
        endpoints.put("participants", "/api/livekit/room/{room_name}/participants");
        endpoints.put("signaling", "/ws/{room_id}/{user_id}");
        endpoints.put("health", "/health");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "MeetRelay Video Conference API");
        body.put("status", "running");
        body.put("endpoints", endpoints);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("livekit_configured", conferenceService.isConfigured());
        return ResponseEntity.ok(body);
    }
}
