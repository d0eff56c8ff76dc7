package com.company.placeholder.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

/**
 * One stored version of a placeholder value. Rows are never mutated in place by readers;
 * a newer version supersedes this one by flipping {@code latestVersion} in the store.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CacheEntry implements Serializable {
    private static final long serialVersionUID = 1L;

    String entryId;

    // Identity
    String placeholderId;
    String templateId;
    String dataSourceId;
    String cacheKey;

    // Content address and run grouping
    String versionHash;
    String executionBatchId;

    // Payload
    String rawResult;
    String formattedText;
    String executionSql;
    Long executionTimeMs;
    Integer rowCount;
    boolean success;

    // Lifecycle
    Instant createdAt;
    Instant expiresAt;
    int hitCount;
    Instant lastHitAt;
    boolean latestVersion;

    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    public boolean isServableAt(Instant now) {
        return success && latestVersion && !isExpiredAt(now);
    }
}
