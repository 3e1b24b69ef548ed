package com.catalog.core.aggregation;

import com.catalog.common.model.AggregatedSiteEntry;

import java.util.Comparator;

public enum SortOption {
    QUALITY(Comparator.comparingDouble(AggregatedSiteEntry::getQualityScore).reversed()),
    RELIABILITY(Comparator.comparingDouble(AggregatedSiteEntry::getReliabilityScore).reversed()),
    RECENT(Comparator.comparingLong(AggregatedSiteEntry::getLastSeen).reversed()),
    NAME(Comparator.comparing(AggregatedSiteEntry::getName, String.CASE_INSENSITIVE_ORDER));

    private final Comparator<AggregatedSiteEntry> comparator;

    SortOption(Comparator<AggregatedSiteEntry> comparator) {
        this.comparator = comparator;
    }

    /** Ties fall back to the key so pages stay stable. */
    public Comparator<AggregatedSiteEntry> comparator() {
        return comparator.thenComparing(AggregatedSiteEntry::getKey);
    }
}
