package com.company.placeholder.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    private static final LocalDateTime RUN = LocalDateTime.of(2024, 6, 10, 9, 0);

    @Test
    @DisplayName("cache key is a 32-char hex digest of placeholder and data source")
    void cacheKeyShape() {
        String key = CacheKeys.cacheKey("ph-1", "reports");

        assertEquals(CacheKeys.SHORT_HASH_LENGTH, key.length());
        assertTrue(key.matches("[0-9a-f]+"));
        assertEquals(key, CacheKeys.cacheKey("ph-1", "reports"));
        assertNotEquals(key, CacheKeys.cacheKey("ph-1", "archive"));
        assertNotEquals(key, CacheKeys.cacheKey("ph-2", "reports"));
    }

    @Test
    @DisplayName("version hash changes with SQL, parameters and execution time")
    void versionHashVolatility() {
        String base = CacheKeys.versionHash("SELECT 1", "{}", RUN);

        assertEquals(base, CacheKeys.versionHash("SELECT 1", "{}", RUN));
        assertNotEquals(base, CacheKeys.versionHash("SELECT 2", "{}", RUN));
        assertNotEquals(base, CacheKeys.versionHash("SELECT 1", "{\"a\":\"1\"}", RUN));
        assertNotEquals(base, CacheKeys.versionHash("SELECT 1", "{}", RUN.plusSeconds(1)));
    }

    @Test
    @DisplayName("sha256 of the empty string")
    void knownDigest() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", CacheKeys.sha256(""));
    }
}
