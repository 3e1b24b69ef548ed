package com.catalog.services.database;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Optional;

/**
 * Embedded H2 database holding the persisted blobs (source list, last directory).
 */
public class DatabaseService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);
    private final Jdbi jdbi;

    /** Opens (or creates) the file database at {@code dbPath}, relative to the working dir. */
    public DatabaseService(String dbPath) {
        this(fileUrl(dbPath), dbPath);
    }

    private static String fileUrl(String dbPath) {
        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        // H2 2.x verlangt ./ für relative Pfade
        String path = new File(dbPath).isAbsolute() ? dbPath : "./" + dbPath;
        return "jdbc:h2:" + path +
                ";DB_CLOSE_DELAY=-1" +
                ";DATABASE_TO_UPPER=FALSE" +
                ";AUTO_SERVER=TRUE";
    }

    /** For tests: {@code jdbc:h2:mem:...} */
    public static DatabaseService forUrl(String jdbcUrl) {
        return new DatabaseService(jdbcUrl, jdbcUrl);
    }

    private DatabaseService(String jdbcUrl, String label) {
        this.jdbi = Jdbi.create(jdbcUrl);
        logger.info("🗄️ Database initialized: {}", label);
        initializeSchema();
    }

    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("""
                        CREATE TABLE IF NOT EXISTS blobs (
                            blob_key VARCHAR(255) PRIMARY KEY,
                            payload CLOB NOT NULL,
                            updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        )
                    """);
            logger.info("✅ Database schema initialized");
        });
    }

    public Optional<String> loadBlob(String key) {
        return jdbi.withHandle(handle -> handle
                .createQuery("SELECT payload FROM blobs WHERE blob_key = :key")
                .bind("key", key)
                .mapTo(String.class)
                .findOne());
    }

    public void saveBlob(String key, String payload) {
        jdbi.useHandle(handle -> handle
                .createUpdate("MERGE INTO blobs (blob_key, payload, updated_at) KEY (blob_key) "
                        + "VALUES (:key, :payload, CURRENT_TIMESTAMP)")
                .bind("key", key)
                .bind("payload", payload)
                .execute());
    }

    public boolean deleteBlob(String key) {
        return jdbi.withHandle(handle -> handle
                .createUpdate("DELETE FROM blobs WHERE blob_key = :key")
                .bind("key", key)
                .execute()) > 0;
    }

    public int countBlobs() {
        return jdbi.withHandle(handle -> handle
                .createQuery("SELECT COUNT(*) FROM blobs")
                .mapTo(Integer.class)
                .one());
    }

    public void shutdown() {
        try {
            jdbi.useHandle(handle -> handle.execute("SHUTDOWN"));
        } catch (Exception e) {
            logger.warn("Error shutting down database: {}", e.getMessage());
        }
        logger.info("✅ Database shutdown complete");
    }
}
