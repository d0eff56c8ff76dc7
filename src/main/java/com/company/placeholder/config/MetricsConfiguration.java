package com.company.placeholder.config;

import com.company.placeholder.cache.CacheVersioningStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final CacheVersioningStore cacheStore;

    @Bean
    public MeterBinder placeholderCacheMetrics() {
        return (registry) -> {
            Gauge.builder("placeholder.cache.entries.latest", cacheStore, store -> {
                        try {
                            return store.countLatestValid();
                        } catch (Exception e) {
                            log.warn("Failed to count latest cache entries", e);
                            return 0;
                        }
                    })
                    .description("Number of latest, unexpired placeholder cache versions")
                    .register(registry);

            log.info("Placeholder cache metrics registered");
        };
    }
}
