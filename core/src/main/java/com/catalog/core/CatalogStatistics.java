package com.catalog.core;

/**
 * Point-in-time counters; totalSites counts every (source, site) contribution, uniqueSites
 * the merged entries.
 */
public record CatalogStatistics(
        int totalSources,
        int activeSources,
        int totalSites,
        int uniqueSites,
        int categories,
        int loadedPlugins,
        long aggregations,
        long lastAggregationTime,
        double averageFetchLatencyMs,
        double successRate,
        double cacheHitRate,
        long resolutions,
        long successfulResolutions) {
}
