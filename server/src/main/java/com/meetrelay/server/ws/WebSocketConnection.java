package com.meetrelay.server.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link Connection} over a Spring {@link WebSocketSession}. Writes are serialized by a
 * {@link ConcurrentWebSocketSessionDecorator}; going over its time or buffer limit
 * throws {@code SessionLimitExceededException} from {@link #send}.
 */
public class WebSocketConnection implements Connection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final WebSocketSession session;

    public WebSocketConnection(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void ping() throws IOException {
        session.sendMessage(new PingMessage());
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("[WARN] close failed session={} {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketConnection[" + session.getId() + "]";
    }
}
