package com.catalog.core.resolve;

import com.catalog.core.CatalogException;

public class NoResolverAvailableException extends CatalogException {
    public NoResolverAvailableException(String entryKey) {
        super("No loaded resolver plugin matches entry " + entryKey);
    }
}
