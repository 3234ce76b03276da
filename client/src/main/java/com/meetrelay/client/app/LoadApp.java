package com.meetrelay.client.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetrelay.client.config.ClientConfig;
import com.meetrelay.client.metrics.Metrics;
import com.meetrelay.client.model.OfferFactory;
import com.meetrelay.client.ws.SignalPeer;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class LoadApp {
    private static final Logger log = LoggerFactory.getLogger(LoadApp.class);

    public static void main(String[] args) throws Exception {
        ClientConfig cfg = ClientConfig.fromArgs(args);
        log.info("[BOOT] base={} rooms={} peersPerRoom={} offersPerPeer={} timeout={}s",
                cfg.baseWsUrl(), cfg.rooms(), cfg.peersPerRoom(), cfg.offersPerPeer(), cfg.timeoutSeconds());

        ObjectMapper mapper = new ObjectMapper();
        OfferFactory factory = new OfferFactory(mapper);
        Metrics metrics = new Metrics();
        OkHttpClient client = new OkHttpClient.Builder()
                .pingInterval(10, TimeUnit.SECONDS)
                .build();

        CountDownLatch deliveries = new CountDownLatch((int) Math.min(Integer.MAX_VALUE, cfg.expectedDeliveries()));
        List<List<SignalPeer>> rooms = new ArrayList<>();

        long t0 = System.nanoTime();

        // Join peers room by room so every peer is present before offers start
        for (int r = 1; r <= cfg.rooms(); r++) {
            List<SignalPeer> peers = new ArrayList<>();
            for (int p = 1; p <= cfg.peersPerRoom(); p++) {
                SignalPeer peer = new SignalPeer(cfg.peerId(r, p), cfg.url(r, p), mapper, metrics, deliveries);
                if (!peer.connect(client, 5_000)) {
                    log.warn("[WARN] peer={} could not connect", peer.peerId());
                    continue;
                }
                peers.add(peer);
            }
            awaitPresence(peers, cfg.peersPerRoom() - 1);
            rooms.add(peers);
        }

        ScheduledExecutorService mon = Executors.newSingleThreadScheduledExecutor();
        mon.scheduleAtFixedRate(() -> log.info("progress sent={} delivered={} fail={}",
                metrics.sent.get(), metrics.delivered.get(), metrics.fail.get()), 1, 1, TimeUnit.SECONDS);

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(32, cfg.rooms() * cfg.peersPerRoom())));
        for (List<SignalPeer> peers : rooms) {
            List<String> ids = peers.stream().map(SignalPeer::peerId).toList();
            for (SignalPeer peer : peers) {
                pool.submit(() -> peer.sendOffers(factory, ids, cfg.offersPerPeer()));
            }
        }
        pool.shutdown();
        pool.awaitTermination(cfg.timeoutSeconds(), TimeUnit.SECONDS);

        if (!deliveries.await(cfg.timeoutSeconds(), TimeUnit.SECONDS)) {
            log.warn("[WARN] timed out with {} deliveries outstanding", deliveries.getCount());
        }
        long t1 = System.nanoTime();

        for (List<SignalPeer> peers : rooms) {
            for (SignalPeer peer : peers) peer.close();
        }
        for (List<SignalPeer> peers : rooms) {
            for (SignalPeer peer : peers) peer.awaitClosed(2_000);
        }
        mon.shutdownNow();
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();

        Metrics.Summary s = metrics.summarize(t0, t1);
        System.out.printf(
                "LOAD sent=%d delivered=%d/%d fail=%d joined=%d left=%d conn=%d disc=%d time=%.2fs "
                        + "deliver_tps=%.1f p50=%.2fms p95=%.2fms p99=%.2fms mean=%.2fms min=%.2fms max=%.2fms%n",
                s.sent(), s.delivered(), cfg.expectedDeliveries(), s.fail(), s.joined(), s.left(),
                s.connections(), s.disconnects(), s.seconds(), s.deliverTps(),
                s.p50ms(), s.p95ms(), s.p99ms(), s.meanMs(), s.minMs(), s.maxMs());
    }

    // The first peer in a room hears a user-joined for every later arrival
    private static void awaitPresence(List<SignalPeer> peers, int expectedJoins) throws InterruptedException {
        if (peers.isEmpty() || expectedJoins <= 0) return;
        SignalPeer first = peers.get(0);
        long deadline = System.currentTimeMillis() + 5_000;
        while (first.joinsSeen() < expectedJoins && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        if (first.joinsSeen() < expectedJoins) {
            log.warn("[WARN] peer={} saw {}/{} joins before offers started",
                    first.peerId(), first.joinsSeen(), expectedJoins);
        }
    }
}
