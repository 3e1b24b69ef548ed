package com.catalog.core.source;

import com.catalog.core.CatalogException;

public class UnknownSourceException extends CatalogException {
    private final String sourceId;

    public UnknownSourceException(String sourceId) {
        super("Unknown config source: " + sourceId);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
