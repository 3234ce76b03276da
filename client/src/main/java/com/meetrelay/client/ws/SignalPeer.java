package com.meetrelay.client.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetrelay.client.metrics.Metrics;
import com.meetrelay.client.model.OfferFactory;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One simulated participant; counts what it receives and records relay latency.
 */
public class SignalPeer extends WebSocketListener {
    private static final Logger log = LoggerFactory.getLogger(SignalPeer.class);

    private final String peerId;
    private final String url;
    private final ObjectMapper mapper;
    private final Metrics metrics;
    private final CountDownLatch deliveries;

    private final CountDownLatch opened = new CountDownLatch(1);
    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicInteger joinsSeen = new AtomicInteger();
    private volatile WebSocket ws;

    public SignalPeer(String peerId, String url, ObjectMapper mapper, Metrics metrics, CountDownLatch deliveries) {
        this.peerId = peerId;
        this.url = url;
        this.mapper = mapper;
        this.metrics = metrics;
        this.deliveries = deliveries;
    }

    public String peerId() {
        return peerId;
    }

    public int joinsSeen() {
        return joinsSeen.get();
    }

    /** Opens the connection and waits for the handshake. */
    public boolean connect(OkHttpClient client, long timeoutMs) throws InterruptedException {
        client.newWebSocket(new Request.Builder().url(url).build(), this);
        return opened.await(timeoutMs, TimeUnit.MILLISECONDS) && ws != null;
    }

    /** Sends {@code count} offers to each target. Returns how many were enqueued. */
    public int sendOffers(OfferFactory factory, List<String> targets, int count) {
        WebSocket socket = ws;
        if (socket == null) return 0;
        int queued = 0;
        for (int seq = 0; seq < count; seq++) {
            for (String target : targets) {
                if (target.equals(peerId)) continue;
                if (socket.send(factory.offer(peerId, target, seq))) {
                    metrics.sent.incrementAndGet();
                    queued++;
                } else {
                    metrics.fail.incrementAndGet();
                }
            }
        }
        return queued;
    }

    public void close() {
        WebSocket socket = ws;
        if (socket != null) socket.close(1000, "done");
    }

    public boolean awaitClosed(long timeoutMs) throws InterruptedException {
        return closed.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override public void onOpen(WebSocket webSocket, Response response) {
        ws = webSocket;
        metrics.connections.incrementAndGet();
        opened.countDown();
    }

    @Override public void onMessage(WebSocket webSocket, String text) {
        JsonNode msg;
        try {
            msg = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[WARN] peer={} unreadable frame: {}", peerId, e.getOriginalMessage());
            return;
        }
        String type = msg.path("type").asText("");
        switch (type) {
            case "user-joined" -> {
                joinsSeen.incrementAndGet();
                metrics.joined.incrementAndGet();
            }
            case "user-left" -> metrics.left.incrementAndGet();
            case OfferFactory.OFFER -> {
                JsonNode sentAt = msg.path("data").path(OfferFactory.SENT_AT);
                if (sentAt.isNumber()) {
                    metrics.recordLatency(System.nanoTime() - sentAt.asLong());
                }
                metrics.delivered.incrementAndGet();
                deliveries.countDown();
            }
            default -> log.debug("[RECV] peer={} type={}", peerId, type);
        }
    }

    @Override public void onClosing(WebSocket webSocket, int code, String reason) {
        webSocket.close(code, null);
    }

    @Override public void onClosed(WebSocket webSocket, int code, String reason) {
        metrics.disconnects.incrementAndGet();
        if (code != 1000) {
            log.warn("[CLOSE] peer={} code={} reason={}", peerId, code, reason);
        }
        closed.countDown();
    }

    @Override public void onFailure(WebSocket webSocket, Throwable t, Response response) {
        metrics.fail.incrementAndGet();
        log.warn("[FAIL] peer={} url={} error={}", peerId, url, t.toString());
        opened.countDown();
        closed.countDown();
    }
}
