package com.catalog.core.aggregation;

import com.catalog.common.model.AggregatedSiteEntry;

import java.util.List;

public record DirectoryPage(List<AggregatedSiteEntry> sites, int total, int page, int pageSize) {
    public DirectoryPage {
        sites = List.copyOf(sites);
    }

    public int totalPages() {
        return pageSize <= 0 ? 0 : (int) ((total + (long) pageSize - 1) / pageSize);
    }
}
