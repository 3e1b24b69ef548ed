package com.catalog.core.plugin;

import com.catalog.core.CatalogException;

public class PluginLoadException extends CatalogException {
    public PluginLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
