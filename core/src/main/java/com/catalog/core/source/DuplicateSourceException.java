package com.catalog.core.source;

import com.catalog.core.CatalogException;

public class DuplicateSourceException extends CatalogException {
    public DuplicateSourceException(String message) {
        super(message);
    }
}
