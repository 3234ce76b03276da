package com.meetrelay.server.ws;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * One participant's persistent channel. Implementations must serialize concurrent
 * {@link #send} calls so that messages leave in the order they were handed over.
 */
public interface Connection {

    String id();

    void send(String text) throws IOException;

    void ping() throws IOException;

    boolean isOpen();

    /** Closing an already closed connection is a no-op. */
    void close(CloseStatus status);
}
