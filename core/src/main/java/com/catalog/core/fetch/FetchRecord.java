package com.catalog.core.fetch;

/** Outcome of one fetch attempt against a config source. */
public record FetchRecord(boolean success, long latencyMs, long timestamp) {
}
