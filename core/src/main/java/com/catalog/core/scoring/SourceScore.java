package com.catalog.core.scoring;

/** Trust metrics of a config source, both in [0, 1]. */
public record SourceScore(double quality, double reliability) {
    public static final SourceScore NEUTRAL = new SourceScore(0.5, 0.5);
}
