package com.catalog.services.database;

import com.catalog.api.BlobStore;
import org.jdbi.v3.core.JdbiException;

import java.io.IOException;
import java.util.Optional;

/** {@link BlobStore} backed by the {@code blobs} table. */
public class DatabaseBlobStore implements BlobStore {
    private final DatabaseService database;

    public DatabaseBlobStore(DatabaseService database) {
        this.database = database;
    }

    @Override
    public Optional<String> load(String key) throws IOException {
        try {
            return database.loadBlob(key);
        } catch (JdbiException e) {
            throw new IOException("Failed to load blob " + key, e);
        }
    }

    @Override
    public void save(String key, String blob) throws IOException {
        try {
            database.saveBlob(key, blob);
        } catch (JdbiException e) {
            throw new IOException("Failed to save blob " + key, e);
        }
    }

    @Override
    public void delete(String key) throws IOException {
        try {
            database.deleteBlob(key);
        } catch (JdbiException e) {
            throw new IOException("Failed to delete blob " + key, e);
        }
    }
}
