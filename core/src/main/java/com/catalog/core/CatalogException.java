package com.catalog.core;

/**
 * Base for errors that propagate to callers of the {@link Kernel}.
 */
public class CatalogException extends RuntimeException {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
