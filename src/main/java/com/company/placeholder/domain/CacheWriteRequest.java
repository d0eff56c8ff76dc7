package com.company.placeholder.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A computed value about to be stored as a new cache version.
 */
@Value
@Builder
public class CacheWriteRequest {
    String templateId;
    String rawResult;
    String formattedText;
    String executionSql;
    Long executionTimeMs;
    Integer rowCount;

    @Builder.Default
    boolean success = true;

    int cacheTtlHours;
}
