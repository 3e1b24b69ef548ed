package com.catalog.common.model;

import java.util.Map;

public record DrmDescriptor(Scheme scheme, String licenseUrl, Map<String, String> headers) {
    public enum Scheme { WIDEVINE, PLAYREADY, FAIRPLAY, CLEARKEY }

    public DrmDescriptor {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
