package com.lob.common;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.atomic.LongAdder;

/**
 * Latency histogram for one operation, shared by all threads that perform it.
 * Values are recorded in nanoseconds and reported in microseconds, one interval at a time.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Histogram histogram;
    private final LongAdder count = new LongAdder();
    private final String name;

    public LatencyStats(String name) {
        this.name = name;
        // max 10 seconds, 3 sig figs
        this.histogram = new ConcurrentHistogram(10_000_000_000L, 3);
    }

    public void record(long latencyNanos) {
        histogram.recordValue(Math.min(latencyNanos, histogram.getHighestTrackableValue()));
        count.increment();
    }

    public long count() { return count.sum(); }

    public long percentileNanos(double percentile) { return histogram.getValueAtPercentile(percentile); }

    /**
     * Logs the interval's percentiles at INFO and starts a new interval. Nothing is
     * logged for an interval without samples.
     *
     * @return the number of samples reported
     */
    public long logAndReset() {
        long total = count.sumThenReset();
        if (total == 0) return 0;
        log.info("{} count={} p50={}µs p99={}µs p999={}µs max={}µs",
                name, total,
                micros(histogram.getValueAtPercentile(50)),
                micros(histogram.getValueAtPercentile(99)),
                micros(histogram.getValueAtPercentile(99.9)),
                micros(histogram.getMaxValue()));
        histogram.reset();
        return total;
    }

    private static String micros(long nanos) {
        return String.format(Locale.ROOT, "%.1f", nanos / 1_000.0);
    }
}
