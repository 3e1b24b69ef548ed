package com.catalog.api;

import com.catalog.common.model.ResolvedStream;

import java.util.Optional;

/**
 * Contract for resolver plugins. Implementations ship in their own jar and are
 * discovered via {@link java.util.ServiceLoader}.
 */
public interface ResolverPlugin extends AutoCloseable {
    // Muss mit der id im Plugin-Deskriptor übereinstimmen
    String getId();

    String getVersion();

    /**
     * Turns a directory entry into a playable stream.
     *
     * @return the stream, or empty when the entry is not something this plugin handles
     * @throws Exception on any failure while resolving; the caller records it and moves on
     */
    Optional<ResolvedStream> resolve(ResolveRequest request) throws Exception;

    /** Called once the plugin is unloaded and no resolution uses it anymore. */
    @Override
    default void close() {
    }
}
