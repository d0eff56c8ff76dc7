package com.company.placeholder.scheduled;

import com.company.placeholder.config.PlaceholderProperties;
import com.company.placeholder.repository.PlaceholderCacheRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps the cache table bounded: purges long-expired rows and strips raw results
 * from old superseded versions.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "placeholder.cache.maintenance.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class CacheMaintenanceJob {

    private final PlaceholderCacheRepository repository;
    private final PlaceholderProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(cron = "${placeholder.cache.maintenance.cron:0 30 3 * * *}")
    public void runMaintenance() {
        log.info("Starting cache maintenance");
        purgeExpired();
        compactSuperseded();
    }

    /**
     * @return rows deleted
     */
    public int purgeExpired() {
        Instant threshold = clock.instant()
                .minus(Duration.ofDays(properties.getCache().getMaintenance().getRetentionDays()));
        try {
            int deleted = repository.deleteExpiredBefore(threshold);

            log.info("Purged {} cache row(s) expired before {}", deleted, threshold);
            meterRegistry.counter("placeholder.cache.maintenance.purged").increment(deleted);
            return deleted;

        } catch (Exception e) {
            log.error("Failed to purge expired cache rows", e);
            meterRegistry.counter("placeholder.cache.maintenance.failures").increment();
            return 0;
        }
    }

    /**
     * @return rows whose raw result was dropped
     */
    public int compactSuperseded() {
        Instant threshold = clock.instant()
                .minus(Duration.ofDays(properties.getCache().getMaintenance().getCompactAfterDays()));
        try {
            int compacted = repository.compactSupersededBefore(threshold);

            log.info("Compacted {} superseded cache row(s) created before {}", compacted, threshold);
            meterRegistry.counter("placeholder.cache.maintenance.compacted").increment(compacted);
            return compacted;

        } catch (Exception e) {
            log.error("Failed to compact superseded cache rows", e);
            meterRegistry.counter("placeholder.cache.maintenance.failures").increment();
            return 0;
        }
    }
}
