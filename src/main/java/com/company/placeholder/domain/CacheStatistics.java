package com.company.placeholder.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {
    private long totalEntries;
    private long validEntries;
    private long expiredEntries;
    private long totalHits;
    private double cacheHitRate; // hits per 100 entries
    private double avgExecutionTimeMs;

    public static CacheStatistics empty() {
        return new CacheStatistics();
    }
}
