package com.catalog.test;

import com.catalog.api.BlobStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBlobStore implements BlobStore {
    private final Map<String, String> blobs = new ConcurrentHashMap<>();

    @Override
    public Optional<String> load(String key) {
        return Optional.ofNullable(blobs.get(key));
    }

    @Override
    public void save(String key, String blob) {
        blobs.put(key, blob);
    }

    @Override
    public void delete(String key) {
        blobs.remove(key);
    }

    public boolean contains(String key) {
        return blobs.containsKey(key);
    }
}
