package com.catalog.common.model;

/** Note attached to a directory for a source that contributed nothing in a cycle. */
public record SourceFailure(String sourceId, String url, Kind kind, String message) {
    public enum Kind { FETCH, TIMEOUT, PARSE, STALE }
}
