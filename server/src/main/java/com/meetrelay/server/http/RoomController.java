package com.meetrelay.server.http;

import com.meetrelay.server.media.RoomDescriptor;
import com.meetrelay.server.model.CreateRoomRequest;
import com.meetrelay.server.model.RoomInfo;
import com.meetrelay.server.service.ConferenceService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Room lifecycle on the media service.
 */
@RestController
@RequestMapping("/api/livekit")
public class RoomController {

    private final ConferenceService conferenceService;

    public RoomController(ConferenceService conferenceService) {
        this.conferenceService = conferenceService;
    }

    @PostMapping("/room")
    public ResponseEntity<Map<String, Object>> createRoom(@Valid @RequestBody CreateRoomRequest request) {
        RoomDescriptor room = conferenceService.createRoom(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roomName", room.name());
        body.put("sid", room.sid());
        body.put("maxParticipants", room.maxParticipants());
        body.put("creationTime", room.creationTime());
        body.put("metadata", room.metadata());
        body.put("status", "created");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/rooms")
    public ResponseEntity<Map<String, Object>> listRooms() {
        List<RoomDescriptor> rooms = conferenceService.listRooms();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rooms", rooms);
        body.put("total", rooms.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/room/{roomName}")
    public ResponseEntity<RoomInfo> getRoom(@PathVariable String roomName) {
        return ResponseEntity.ok(conferenceService.getRoom(roomName));
    }

    @DeleteMapping("/room/{roomName}")
    public ResponseEntity<Map<String, Object>> deleteRoom(@PathVariable String roomName) {
        conferenceService.deleteRoom(roomName);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roomName", roomName);
        body.put("status", "deleted");
        body.put("message", "Room '" + roomName + "' has been deleted");
        return ResponseEntity.ok(body);
    }
}
