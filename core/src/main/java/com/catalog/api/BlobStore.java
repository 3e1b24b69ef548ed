package com.catalog.api;

import java.io.IOException;
import java.util.Optional;

/**
 * Key/value persistence for opaque serialized blobs (registry list, directory snapshot).
 */
public interface BlobStore {
    Optional<String> load(String key) throws IOException;

    void save(String key, String blob) throws IOException;

    void delete(String key) throws IOException;
}
