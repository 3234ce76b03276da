package com.meetrelay.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetrelay.server.model.SignalMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriTemplate;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Lifecycle of one signaling connection on {@code /ws/{roomId}/{userId}}:
 * - established: register in the {@link RoomRegistry}, close a superseded connection, announce the join
 * - text frame: decode as {@link SignalMessage} and hand to the {@link SignalRelay};
 *   an undecodable frame ends the connection
 * - transport error / closed: release the registry entry and announce the leave, exactly once
 */
@Component
public class SignalingHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(SignalingHandler.class);

    public static final String PATH_PATTERN = "/ws/*/*";
    static final String MEMBERSHIP_ATTR = "meetrelay.membership";
    static final CloseStatus SUPERSEDED = CloseStatus.POLICY_VIOLATION.withReason("superseded");

    private final UriTemplate template = new UriTemplate("/ws/{roomId}/{userId}");

    private final RoomRegistry roomRegistry;
    private final SignalRelay relay;
    private final LivenessMonitor livenessMonitor;
    private final ObjectMapper mapper;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    public SignalingHandler(RoomRegistry roomRegistry,
                            SignalRelay relay,
                            LivenessMonitor livenessMonitor,
                            ObjectMapper mapper,
                            @Value("${relay.send.time-limit-ms:5000}") int sendTimeLimitMs,
                            @Value("${relay.send.buffer-size-limit:524288}") int sendBufferSizeLimit) {
        this.roomRegistry = roomRegistry;
        this.relay = relay;
        this.livenessMonitor = livenessMonitor;
        this.mapper = mapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Map<String, String> vars = extractPath(session.getUri());
        String roomId = vars.get("roomId");
        String userId = vars.get("userId");
        if (isBlank(roomId) || isBlank(userId)) {
            log.warn("[WARN] rejecting session={} uri={}", session.getId(), session.getUri());
            closeQuietly(session, CloseStatus.BAD_DATA);
            return;
        }

        Connection connection = new WebSocketConnection(session, sendTimeLimitMs, sendBufferSizeLimit);
        Membership membership = roomRegistry.register(roomId, userId, connection);
        session.getAttributes().put(MEMBERSHIP_ATTR, membership);

        membership.superseded().ifPresent(old -> {
            log.info("[REPLACE] room={} user={} old={} new={}", roomId, userId, old.id(), connection.id());
            old.close(SUPERSEDED);
        });

        log.info("[JOIN] room={} user={} total={}", roomId, userId, roomRegistry.members(roomId).size());
        relay.announceJoin(roomId, userId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Membership membership = membership(session);
        if (membership == null || membership.isReleased()) {
            return;
        }

        String payload = message.getPayload();
        SignalMessage signal = decode(payload);
        if (signal == null) {
            log.warn("[WARN] undecodable frame room={} user={}, closing",
                    membership.roomId(), membership.participantId());
            release(membership);
            closeQuietly(session, CloseStatus.BAD_DATA);
            return;
        }

        relay.route(membership.roomId(), membership.participantId(), signal, payload);
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        Membership membership = membership(session);
        if (membership != null) {
            livenessMonitor.markAlive(membership.connection());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        Membership membership = membership(session);
        log.debug("[WARN] transport error session={} {}", session.getId(), exception.getMessage());
        if (membership != null) {
            release(membership);
        }
        closeQuietly(session, CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Membership membership = membership(session);
        if (membership != null) {
            release(membership);
        }
    }

    private void release(Membership membership) {
        livenessMonitor.forget(membership.connection());
        if (membership.release()) {
            log.info("[LEAVE] room={} user={} remaining={}", membership.roomId(), membership.participantId(),
                    roomRegistry.members(membership.roomId()).size());
            relay.announceLeave(membership.roomId(), membership.participantId());
        }
    }

    private SignalMessage decode(String payload) {
        try {
            return mapper.readValue(payload, SignalMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("[WARN] invalid json: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Membership membership(WebSocketSession session) {
        return (Membership) session.getAttributes().get(MEMBERSHIP_ATTR);
    }

    private Map<String, String> extractPath(URI uri) {
        if (uri == null) return Map.of();
        return template.match(uri.getPath());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("[WARN] close failed session={} {}", session.getId(), e.getMessage());
        }
    }
}
