package com.catalog.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One playable content site as listed by a single config source.
 * {@code key} is the dedup identity inside a fragment and across the directory.
 */
public final class SiteEntry {
    private final String key;
    private final String name;
    private final SiteKind kind;
    private final int kindCode;
    private final String endpoint;
    private final boolean searchable;
    private final boolean quickSearch;
    private final boolean filterable;
    private final SiteExtension extension;
    private final ResolveHint hint;
    private final Map<String, String> headers;
    private final long updatedAt;

    private SiteEntry(Builder b) {
        this.key = Objects.requireNonNull(b.key, "key");
        this.name = Objects.requireNonNull(b.name, "name");
        this.kindCode = b.kindCode;
        this.kind = SiteKind.fromCode(b.kindCode);
        this.endpoint = Objects.requireNonNull(b.endpoint, "endpoint");
        this.searchable = b.searchable;
        this.quickSearch = b.quickSearch;
        this.filterable = b.filterable;
        this.extension = b.extension != null ? b.extension : SiteExtension.EMPTY;
        this.hint = b.hint != null ? b.hint : ResolveHint.NONE;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.updatedAt = b.updatedAt;
    }

    public static Builder builder(String key, String name, String endpoint) {
        return new Builder(key, name, endpoint);
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public SiteKind getKind() { return kind; }
    public int getKindCode() { return kindCode; }
    public String getEndpoint() { return endpoint; }
    public boolean isSearchable() { return searchable; }
    public boolean isQuickSearch() { return quickSearch; }
    public boolean isFilterable() { return filterable; }
    public SiteExtension getExtension() { return extension; }
    public ResolveHint getHint() { return hint; }
    public Map<String, String> getHeaders() { return headers; }

    /** Epoch millis the feed claims the entry was last updated, 0 if unknown. */
    public long getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "SiteEntry[" + key + " '" + name + "' " + kind + " " + endpoint + "]";
    }

    public static final class Builder {
        private final String key;
        private final String name;
        private final String endpoint;
        private int kindCode = 0;
        private boolean searchable;
        private boolean quickSearch;
        private boolean filterable;
        private SiteExtension extension;
        private ResolveHint hint;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private long updatedAt;

        private Builder(String key, String name, String endpoint) {
            this.key = key;
            this.name = name;
            this.endpoint = endpoint;
        }

        public Builder kindCode(int code) { this.kindCode = code; return this; }
        public Builder searchable(boolean v) { this.searchable = v; return this; }
        public Builder quickSearch(boolean v) { this.quickSearch = v; return this; }
        public Builder filterable(boolean v) { this.filterable = v; return this; }
        public Builder extension(SiteExtension v) { this.extension = v; return this; }
        public Builder hint(ResolveHint v) { this.hint = v; return this; }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder headers(Map<String, String> values) { if (values != null) this.headers.putAll(values); return this; }
        public Builder updatedAt(long v) { this.updatedAt = v; return this; }

        public SiteEntry build() {
            return new SiteEntry(this);
        }
    }
}
