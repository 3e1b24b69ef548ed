package com.catalog.core.resolve;

import com.catalog.core.CatalogException;

public class UnknownEntryException extends CatalogException {
    public UnknownEntryException(String entryKey) {
        super("No directory entry with key " + entryKey);
    }
}
