package com.catalog.common.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumsTest {

    private static final byte[] DATA = "hello".getBytes(StandardCharsets.UTF_8);
    private static final String SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";
    private static final String MD5 = "5d41402abc4b2a76b9719d911017c592";

    @Test
    void testSha256() {
        assertEquals(SHA256, Checksums.sha256(DATA));
    }

    @Test
    void testMatchesWithAndWithoutPrefix() {
        assertTrue(Checksums.matches(SHA256, DATA));
        assertTrue(Checksums.matches("sha256:" + SHA256.toUpperCase(), DATA));
        assertTrue(Checksums.matches("md5:" + MD5, DATA));
    }

    @Test
    void testMismatchAndGarbage() {
        assertFalse(Checksums.matches("md5:" + SHA256, DATA));
        assertFalse(Checksums.matches("crc32:1234", DATA));
        assertFalse(Checksums.matches("sha256:not-hex", DATA));
        assertFalse(Checksums.matches("", DATA));
        assertFalse(Checksums.matches(SHA256, null));
    }
}
