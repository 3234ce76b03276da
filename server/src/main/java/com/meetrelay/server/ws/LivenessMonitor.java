package com.meetrelay.server.ws;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pings registered connections and closes those with {@code maxMissed} unanswered pings.
 * Interval 0 disables it.
 */
@Component
public class LivenessMonitor {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    static final CloseStatus UNRESPONSIVE = CloseStatus.SESSION_NOT_RELIABLE.withReason("missed heartbeats");

    private final RoomRegistry roomRegistry;
    private final long intervalMs;
    private final int maxMissed;

    // connection id -> pings sent since the last pong
    private final ConcurrentMap<String, AtomicInteger> outstanding = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;

    public LivenessMonitor(RoomRegistry roomRegistry,
                           @Value("${relay.heartbeat.interval-ms:15000}") long intervalMs,
                           @Value("${relay.heartbeat.max-missed:3}") int maxMissed) {
        this.roomRegistry = roomRegistry;
        this.intervalMs = intervalMs;
        this.maxMissed = Math.max(1, maxMissed);
    }

    @PostConstruct
    public void start() {
        if (intervalMs <= 0) {
            log.info("[BOOT] heartbeat disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-heartbeat");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::probeSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[BOOT] heartbeat every {}ms, maxMissed={}", intervalMs, maxMissed);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    public void markAlive(Connection connection) {
        AtomicInteger count = outstanding.get(connection.id());
        if (count != null) count.set(0);
    }

    public void forget(Connection connection) {
        outstanding.remove(connection.id());
    }

    /**
     * One probe round.
     *
     * @return number of connections closed as unresponsive
     */
    public int probe() {
        int closed = 0;
        Set<String> seen = new HashSet<>();
        for (String roomId : roomRegistry.roomIds()) {
            for (Map.Entry<String, Connection> e : roomRegistry.snapshot(roomId).entrySet()) {
                Connection c = e.getValue();
                seen.add(c.id());
                AtomicInteger count = outstanding.computeIfAbsent(c.id(), k -> new AtomicInteger());
                if (count.get() >= maxMissed) {
                    log.info("[PROBE] room={} user={} missed={}, closing", roomId, e.getKey(), count.get());
                    outstanding.remove(c.id());
                    c.close(UNRESPONSIVE);
                    closed++;
                    continue;
                }
                count.incrementAndGet();
                try {
                    c.ping();
                } catch (Exception ex) {
                    log.debug("[PROBE] ping failed room={} user={} {}", roomId, e.getKey(), ex.getMessage());
                }
            }
        }
        // counters re-created for connections that left mid-round
        outstanding.keySet().retainAll(seen);
        return closed;
    }

    int tracked() {
        return outstanding.size();
    }

    private void probeSafely() {
        try {
            probe();
        } catch (RuntimeException e) {
            // keep the schedule alive; a thrown task would cancel future runs
            log.error("[ERROR] heartbeat round failed", e);
        }
    }
}
