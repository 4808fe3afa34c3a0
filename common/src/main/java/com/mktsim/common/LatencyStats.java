package com.mktsim.common;

import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wall-clock latency tracking using HdrHistogram.
 * Record nanos; report percentiles at the end of a run.
 *
 * Not thread-safe: owned by the single kernel thread.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Histogram histogram;
    private final String name;
    private long count;

    public LatencyStats(String name) {
        this.name = name;
        // max 10 seconds, 3 sig figs
        this.histogram = new Histogram(10_000_000_000L, 3);
    }

    public void record(long latencyNanos) {
        histogram.recordValue(Math.min(Math.max(latencyNanos, 0L), histogram.getHighestTrackableValue()));
        count++;
    }

    public long count() { return count; }

    public double percentileMicros(double percentile) {
        return histogram.getValueAtPercentile(percentile) / 1_000.0;
    }

    public void logAndReset() {
        if (count == 0) return;
        if (log.isInfoEnabled()) {
            log.info("[metrics] {} count={} p50={}µs p99={}µs p999={}µs max={}µs",
                    name, count,
                    micros(histogram.getValueAtPercentile(50)),
                    micros(histogram.getValueAtPercentile(99)),
                    micros(histogram.getValueAtPercentile(99.9)),
                    micros(histogram.getMaxValue()));
        }
        histogram.reset();
        count = 0;
    }

    private static String micros(long nanos) {
        return String.format("%.1f", nanos / 1_000.0);
    }
}
