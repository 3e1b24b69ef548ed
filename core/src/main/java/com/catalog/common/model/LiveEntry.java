package com.catalog.common.model;

public record LiveEntry(String name, int type, String url, String playerType, String userAgent,
                        String epg, String logo, boolean boot) {
}
