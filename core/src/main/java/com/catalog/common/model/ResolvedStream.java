package com.catalog.common.model;

import java.util.List;
import java.util.Map;

/**
 * What a resolver hands back: one or more playable urls plus the request headers the
 * player has to send, and the DRM setup when the stream is protected.
 */
public record ResolvedStream(List<String> urls, Map<String, String> headers, DrmDescriptor drm) {
    public ResolvedStream {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("A resolved stream needs at least one url");
        }
        urls = List.copyOf(urls);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ResolvedStream of(String url) {
        return new ResolvedStream(List.of(url), Map.of(), null);
    }

    public String primaryUrl() {
        return urls.get(0);
    }

    public boolean isProtected() {
        return drm != null;
    }
}
