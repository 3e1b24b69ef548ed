package com.catalog.core.fetch;

public class SourceFetchException extends SourceException {
    private final boolean timedOut;

    public SourceFetchException(String sourceId, String message, boolean timedOut, Throwable cause) {
        super(sourceId, message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
