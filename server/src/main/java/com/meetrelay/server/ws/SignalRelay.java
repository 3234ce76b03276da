package com.meetrelay.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetrelay.server.model.SignalMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.util.Map;

/**
 * Signaling routing:
 * - join / leave notifications fan out to the rest of the room
 * - peer messages go verbatim to their {@code target}, or nowhere
 * - a recipient whose write fails is closed
 */
@Component
public class SignalRelay {
    private static final Logger log = LoggerFactory.getLogger(SignalRelay.class);

    private final RoomRegistry roomRegistry;
    private final ObjectMapper mapper;

    public SignalRelay(RoomRegistry roomRegistry, ObjectMapper mapper) {
        this.roomRegistry = roomRegistry;
        this.mapper = mapper;
    }

    /** Tells everyone already in the room, except the newcomer, that {@code participantId} joined. */
    public int announceJoin(String roomId, String participantId) {
        return broadcast(roomId, SignalMessage.userJoined(participantId), participantId);
    }

    /** Tells the remaining members that {@code participantId} left. Call after unregistering. */
    public int announceLeave(String roomId, String participantId) {
        return broadcast(roomId, SignalMessage.userLeft(participantId), null);
    }

    /**
     * Delivers {@code rawText} unchanged to the member named by {@code message.target}.
     * A missing, empty or unknown target drops the message without telling the sender.
     *
     * @return true if the message was handed to the target connection
     */
    public boolean route(String roomId, String senderId, SignalMessage message, String rawText) {
        if (!message.hasTarget()) {
            log.debug("[DROP] room={} from={} type={} reason=no-target", roomId, senderId, message.type);
            return false;
        }
        Connection target = roomRegistry.lookup(roomId, message.target).orElse(null);
        if (target == null) {
            log.debug("[DROP] room={} from={} target={} reason=not-member", roomId, senderId, message.target);
            return false;
        }
        if (!deliver(roomId, message.target, target, rawText)) {
            return false;
        }
        log.debug("[RELAY] room={} from={} to={} type={}", roomId, senderId, message.target, message.type);
        return true;
    }

    /**
     * Sends {@code message} to every member of the room except {@code excludeId}.
     *
     * @return number of successful writes
     */
    public int broadcast(String roomId, SignalMessage message, String excludeId) {
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("[ERROR] cannot encode {}", message, e);
            return 0;
        }

        Map<String, Connection> members = roomRegistry.snapshot(roomId);
        int ok = 0;
        for (Map.Entry<String, Connection> e : members.entrySet()) {
            if (e.getKey().equals(excludeId)) continue;
            if (deliver(roomId, e.getKey(), e.getValue(), json)) ok++;
        }
        log.info("[BROADCAST] room={} type={} from={} delivered={}", roomId, message.type, message.from, ok);
        return ok;
    }

    private boolean deliver(String roomId, String participantId, Connection connection, String text) {
        if (!connection.isOpen()) {
            log.debug("[WARN] skip closed connection room={} participant={}", roomId, participantId);
            return false;
        }
        try {
            connection.send(text);
            return true;
        } catch (SessionLimitExceededException e) {
            // the decorator drops every later write once a limit trips
            log.warn("[WARN] send limit room={} participant={} {}, closing", roomId, participantId, e.getMessage());
            connection.close(e.getStatus());
            return false;
        } catch (Exception e) {
            log.warn("[WARN] send fail room={} participant={} {}, closing", roomId, participantId, e.getMessage());
            connection.close(CloseStatus.SESSION_NOT_RELIABLE);
            return false;
        }
    }
}
