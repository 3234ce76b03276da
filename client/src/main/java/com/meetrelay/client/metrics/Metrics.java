package com.meetrelay.client.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public class Metrics {

    // Frame counters
    public final AtomicLong sent      = new AtomicLong();
    public final AtomicLong delivered = new AtomicLong();
    public final AtomicLong fail      = new AtomicLong();

    // Presence notifications seen by peers
    public final AtomicLong joined = new AtomicLong();
    public final AtomicLong left   = new AtomicLong();

    // Connection statistics
    public final AtomicLong connections = new AtomicLong();
    public final AtomicLong disconnects = new AtomicLong();

    // Relay latency (nanoseconds)
    private final List<Long> latencies = Collections.synchronizedList(new ArrayList<>());
    private final LongAdder sumLatency = new LongAdder();
    private final AtomicLong minLatency = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxLatency = new AtomicLong(Long.MIN_VALUE);

    public void recordLatency(long nanos) {
        latencies.add(nanos);
        sumLatency.add(nanos);
        minLatency.getAndUpdate(v -> Math.min(v, nanos));
        maxLatency.getAndUpdate(v -> Math.max(v, nanos));
    }

    public record Summary(
            long sent, long delivered, long fail,
            long joined, long left,
            long connections, long disconnects,
            double seconds, double deliverTps,
            double p50ms, double p95ms, double p99ms,
            double meanMs, double minMs, double maxMs
    ) {}

    public Summary summarize(long t0, long t1) {
        double seconds = (t1 - t0) / 1_000_000_000.0;
        double deliverTps = seconds > 0 ? delivered.get() / seconds : 0.0;

        double p50 = 0, p95 = 0, p99 = 0, mean = 0, min = 0, max = 0;
        List<Long> copy;
        synchronized (latencies) { copy = new ArrayList<>(latencies); }
        if (!copy.isEmpty()) {
            copy.sort(Long::compare);
            p50  = toMs(percentile(copy, 0.50));
            p95  = toMs(percentile(copy, 0.95));
            p99  = toMs(percentile(copy, 0.99));
            mean = toMs(sumLatency.sum() / (double) copy.size());
            min  = toMs(minLatency.get());
            max  = toMs(maxLatency.get());
        }

        return new Summary(
                sent.get(), delivered.get(), fail.get(),
                joined.get(), left.get(),
                connections.get(), disconnects.get(),
                seconds, deliverTps,
                p50, p95, p99,
                mean, min, max
        );
    }

    private static double toMs(double ns) { return ns / 1_000_000.0; }

    static long percentile(List<Long> sorted, double p) {
        if (sorted.isEmpty()) return 0L;
        int idx = (int) Math.ceil(p * sorted.size()) - 1;
        idx = Math.max(0, Math.min(idx, sorted.size() - 1));
        return sorted.get(idx);
    }
}
