package com.catalog.common.model;

import java.util.Collections;
import java.util.List;

/**
 * Caller or feed supplied preference for resolution: an explicit, ordered list of
 * resolver plugin ids to try instead of the format based selection.
 */
public final class ResolveHint {
    public static final ResolveHint NONE = new ResolveHint(Collections.emptyList());

    private final List<String> fallbackParsers;

    public ResolveHint(List<String> fallbackParsers) {
        this.fallbackParsers = fallbackParsers == null ? Collections.emptyList() : List.copyOf(fallbackParsers);
    }

    public static ResolveHint of(String... pluginIds) {
        return new ResolveHint(List.of(pluginIds));
    }

    public List<String> getFallbackParsers() {
        return fallbackParsers;
    }

    public boolean hasFallbackParsers() {
        return !fallbackParsers.isEmpty();
    }

    @Override
    public String toString() {
        return "ResolveHint" + fallbackParsers;
    }
}
