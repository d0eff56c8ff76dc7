package com.company.placeholder.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchStats {
    int total;
    int periodCount;
    int sqlCount;
    int successCount;
    int failCount;
    int cacheHitCount;
    long executionTimeMs;
}
