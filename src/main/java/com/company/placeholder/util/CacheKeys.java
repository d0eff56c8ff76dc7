package com.company.placeholder.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;

/**
 * Hash-based identifiers for cache rows.
 */
public final class CacheKeys {

    static final int SHORT_HASH_LENGTH = 32;

    private static final char SEPARATOR = '|';

    private CacheKeys() {
    }

    /**
     * Stable per placeholder/data source pair, independent of content
     */
    public static String cacheKey(String placeholderId, String dataSourceId) {
        return sha256("placeholder:" + placeholderId + ":datasource:" + dataSourceId)
                .substring(0, SHORT_HASH_LENGTH);
    }

    /**
     * Changes whenever the SQL text, the parameters or the computation instant change
     */
    public static String versionHash(String filledSql, String canonicalParameters, LocalDateTime executionTime) {
        return sha256(filledSql + SEPARATOR + canonicalParameters + SEPARATOR + executionTime);
    }

    public static String executionBatchId(LocalDateTime executionTime, String reportPeriod, String placeholderId) {
        return sha256(executionTime + String.valueOf(SEPARATOR) + reportPeriod + SEPARATOR + placeholderId)
                .substring(0, SHORT_HASH_LENGTH);
    }

    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
