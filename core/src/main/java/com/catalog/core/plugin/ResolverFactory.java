package com.catalog.core.plugin;

import com.catalog.api.ResolverPlugin;

/**
 * Creates the executable plugin from verified bytes. Only called after the checksum matched.
 */
@FunctionalInterface
public interface ResolverFactory {
    ResolverPlugin create(PluginDescriptor descriptor, byte[] bytes) throws Exception;
}
