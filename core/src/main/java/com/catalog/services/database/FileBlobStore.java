package com.catalog.services.database;

import com.catalog.api.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each blob as {@code <key>.json} in a directory (default: the tools folder).
 * Writes go to a temp file first and are moved into place.
 */
public class FileBlobStore implements BlobStore {
    private static final Logger logger = LoggerFactory.getLogger(FileBlobStore.class);

    private final File dir;

    public FileBlobStore(File dir) {
        this.dir = dir;
    }

    private Path pathFor(String key) {
        if (!key.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("Invalid blob key: " + key);
        }
        return new File(dir, key + ".json").toPath();
    }

    @Override
    public Optional<String> load(String key) throws IOException {
        Path path = pathFor(key);
        if (!Files.exists(path)) return Optional.empty();
        return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    }

    @Override
    public synchronized void save(String key, String blob) throws IOException {
        Files.createDirectories(dir.toPath());
        Path target = pathFor(key);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, blob, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Saved {} ({} chars)", target.getFileName(), blob.length());
    }

    @Override
    public synchronized void delete(String key) throws IOException {
        Files.deleteIfExists(pathFor(key));
    }
}
