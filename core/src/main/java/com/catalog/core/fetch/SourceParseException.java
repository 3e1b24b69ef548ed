package com.catalog.core.fetch;

public class SourceParseException extends SourceException {
    public SourceParseException(String sourceId, String message) {
        super(sourceId, message, null);
    }

    public SourceParseException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }
}
