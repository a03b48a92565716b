package com.sgw.common;

import org.HdrHistogram.Histogram;

import java.util.concurrent.atomic.LongAdder;

/**
 * Latency tracking using HdrHistogram.
 * Record nanos; report percentiles periodically.
 */
public final class LatencyStats {

    // two minutes, above every request ceiling
    private static final long MAX_TRACKABLE_NANOS = 120_000_000_000L;

    private final Histogram histogram;
    private final LongAdder count = new LongAdder();
    private final String name;

    public LatencyStats(String name) {
        this.name = name;
        this.histogram = new Histogram(MAX_TRACKABLE_NANOS, 3);
    }

    public synchronized void record(long latencyNanos) {
        histogram.recordValue(Math.max(0, Math.min(latencyNanos, MAX_TRACKABLE_NANOS)));
        count.increment();
    }

    /** @return a one-line summary, or null when nothing was recorded since the last call */
    public synchronized String summarizeAndReset() {
        long total = count.sumThenReset();
        if (total == 0) return null;
        String line = String.format("%s count=%d p50=%.1fms p99=%.1fms max=%.1fms",
                name, total,
                histogram.getValueAtPercentile(50) / 1_000_000.0,
                histogram.getValueAtPercentile(99) / 1_000_000.0,
                histogram.getMaxValue() / 1_000_000.0);
        histogram.reset();
        return line;
    }
}
