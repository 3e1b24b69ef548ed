package com.catalog.common.model;

import java.util.List;

public record CategoryInfo(String id, String name, List<String> siteKeys) {
    public CategoryInfo {
        siteKeys = List.copyOf(siteKeys);
    }

    public int siteCount() {
        return siteKeys.size();
    }
}
