package com.catalog.services.database;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseBlobStoreTest {

    private DatabaseService db;
    private DatabaseBlobStore store;

    @BeforeEach
    void setUp() {
        db = DatabaseService.forUrl("jdbc:h2:mem:blobs-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
        store = new DatabaseBlobStore(db);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void testSaveLoadOverwrite() throws Exception {
        assertEquals(Optional.empty(), store.load("aggregated_directory"));

        store.save("aggregated_directory", "{\"v\":1}");
        store.save("aggregated_directory", "{\"v\":2}");

        assertEquals(Optional.of("{\"v\":2}"), store.load("aggregated_directory"));
        assertEquals(1, db.countBlobs());
    }

    @Test
    void testDelete() throws Exception {
        store.save("k", "x");
        store.delete("k");
        store.delete("missing");

        assertTrue(store.load("k").isEmpty());
        assertEquals(0, db.countBlobs());
    }

    @Test
    void testLargePayload() throws Exception {
        String big = "x".repeat(200_000);
        store.save("big", big);

        assertEquals(big, store.load("big").orElseThrow());
    }
}
