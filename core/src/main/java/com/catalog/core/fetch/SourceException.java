package com.catalog.core.fetch;

import java.io.IOException;

/**
 * A single config source could not deliver a fragment. Never fatal for an aggregation
 * cycle; the engine turns it into a failure note.
 */
public abstract class SourceException extends IOException {
    private final String sourceId;

    protected SourceException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
