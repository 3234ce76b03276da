package com.meetrelay.server.http;

import com.meetrelay.server.ws.RoomRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only view of the signaling relay's current membership.
 */
@RestController
@RequestMapping("/api/signaling")
public class SignalingStatusController {

    private final RoomRegistry roomRegistry;

    public SignalingStatusController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @GetMapping("/rooms")
    public ResponseEntity<Map<String, Object>> rooms() {
        List<Map<String, Object>> rooms = new ArrayList<>();
        for (String roomId : new TreeSet<>(roomRegistry.roomIds())) {
            rooms.add(describe(roomId, roomRegistry.members(roomId)));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rooms", rooms);
        body.put("total", rooms.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/rooms/{roomId}/members")
    public ResponseEntity<Map<String, Object>> members(@PathVariable String roomId) {
        return ResponseEntity.ok(describe(roomId, roomRegistry.members(roomId)));
    }

    private static Map<String, Object> describe(String roomId, Set<String> members) {
        Map<String, Object> room = new LinkedHashMap<>();
        room.put("roomId", roomId);
        room.put("members", new ArrayList<>(members));
        room.put("total", members.size());
        return room;
    }
}
