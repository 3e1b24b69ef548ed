package com.catalog.services.stats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Laufzeit-Zähler für Fetches, Aggregationen und Resolutions.
 * Cache counters live in the cache layer and are combined by the Kernel.
 */
public class StatisticsManager {
    private final AtomicLong fetches = new AtomicLong();
    private final AtomicLong successfulFetches = new AtomicLong();
    private final AtomicLong totalFetchLatencyMs = new AtomicLong();
    private final AtomicLong aggregations = new AtomicLong();
    private final AtomicLong lastAggregationTime = new AtomicLong();
    private final AtomicLong resolutions = new AtomicLong();
    private final AtomicLong successfulResolutions = new AtomicLong();

    public void recordFetch(boolean success, long latencyMs) {
        fetches.incrementAndGet();
        if (success) successfulFetches.incrementAndGet();
        totalFetchLatencyMs.addAndGet(Math.max(0, latencyMs));
    }

    public void recordAggregation(long timestamp) {
        aggregations.incrementAndGet();
        lastAggregationTime.accumulateAndGet(timestamp, Math::max);
    }

    public void recordResolution(boolean success) {
        resolutions.incrementAndGet();
        if (success) successfulResolutions.incrementAndGet();
    }

    public long getFetches() { return fetches.get(); }
    public long getSuccessfulFetches() { return successfulFetches.get(); }
    public long getAggregations() { return aggregations.get(); }
    public long getLastAggregationTime() { return lastAggregationTime.get(); }
    public long getResolutions() { return resolutions.get(); }
    public long getSuccessfulResolutions() { return successfulResolutions.get(); }

    public double getAverageFetchLatencyMs() {
        long n = fetches.get();
        return n == 0 ? 0.0 : (double) totalFetchLatencyMs.get() / n;
    }

    /** Share of successful fetches, 0 when nothing was fetched yet. */
    public double getSuccessRate() {
        long n = fetches.get();
        return n == 0 ? 0.0 : (double) successfulFetches.get() / n;
    }
}
