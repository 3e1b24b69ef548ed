package com.catalog.core.scoring;

import com.catalog.common.model.ConfigSource;
import com.catalog.core.fetch.FetchRecord;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Computes quality and reliability of a source from its recent fetch outcomes and the
 * age of the entries it publishes. Stateless: same inputs, same score.
 */
public class SourceScorer {
    public static final double NO_HISTORY_RELIABILITY = 0.5;

    private final int window;
    private final double decay;
    private final Duration stalenessThreshold;

    public SourceScorer(int window, double decay, Duration stalenessThreshold) {
        if (window < 1) throw new IllegalArgumentException("window must be >= 1");
        if (decay <= 0 || decay > 1) throw new IllegalArgumentException("decay must be in (0, 1]");
        this.window = window;
        this.decay = decay;
        this.stalenessThreshold = stalenessThreshold;
    }

    /**
     * @param history         fetch outcomes, newest first
     * @param entryTimestamps epoch millis per published entry (feed value or fetch time)
     * @param now             evaluation time in epoch millis
     */
    public SourceScore score(ConfigSource source, List<FetchRecord> history, long[] entryTimestamps, long now) {
        double reliability = reliability(history);
        double quality = reliability * freshness(entryTimestamps, now);
        return new SourceScore(clamp(quality), clamp(reliability));
    }

    /** Exponentially weighted success rate; the newest outcome has weight 1. */
    double reliability(List<FetchRecord> history) {
        if (history == null || history.isEmpty()) return NO_HISTORY_RELIABILITY;
        double weighted = 0;
        double total = 0;
        double weight = 1;
        int n = Math.min(window, history.size());
        for (int i = 0; i < n; i++) {
            if (history.get(i).success()) weighted += weight;
            total += weight;
            weight *= decay;
        }
        return weighted / total;
    }

    /** 1 while the median entry is younger than the threshold, then threshold/age. */
    double freshness(long[] entryTimestamps, long now) {
        if (entryTimestamps == null || entryTimestamps.length == 0) return 1.0;
        long[] ages = new long[entryTimestamps.length];
        for (int i = 0; i < ages.length; i++) ages[i] = Math.max(0, now - entryTimestamps[i]);
        Arrays.sort(ages);
        int mid = ages.length / 2;
        double median = ages.length % 2 == 1 ? ages[mid] : (ages[mid - 1] + ages[mid]) / 2.0;

        double threshold = stalenessThreshold.toMillis();
        if (median <= threshold) return 1.0;
        return threshold / median;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(1, v));
    }
}
