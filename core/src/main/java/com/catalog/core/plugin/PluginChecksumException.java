package com.catalog.core.plugin;

import com.catalog.core.CatalogException;

public class PluginChecksumException extends CatalogException {
    private final String pluginId;

    public PluginChecksumException(String pluginId, String message) {
        super(message);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
