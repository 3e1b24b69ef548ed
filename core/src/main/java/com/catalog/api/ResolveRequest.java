package com.catalog.api;

import com.catalog.common.model.AggregatedSiteEntry;
import com.catalog.common.model.ResolveHint;

/**
 * Input handed to a {@link ResolverPlugin}: the directory entry and the hint the caller
 * passed along (never null, {@link ResolveHint#NONE} when absent).
 */
public record ResolveRequest(AggregatedSiteEntry entry, ResolveHint hint) {
    public ResolveRequest {
        if (hint == null) hint = ResolveHint.NONE;
    }
}
