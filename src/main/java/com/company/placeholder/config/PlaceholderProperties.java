package com.company.placeholder.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for placeholder computation and caching.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "placeholder")
public class PlaceholderProperties {

    @Valid
    private BatchConfig batch = new BatchConfig();

    @Valid
    private TemplateConfig template = new TemplateConfig();

    @Valid
    private CacheConfig cache = new CacheConfig();

    @Valid
    private QueryConfig query = new QueryConfig();

    @Data
    public static class BatchConfig {
        /**
         * Upper bound of simultaneously in-flight query executions per batch.
         */
        @Min(1)
        private int maxConcurrency = 5;
    }

    @Data
    public static class TemplateConfig {
        /**
         * Offset applied to the wall-clock parameters current_time and execution_time.
         */
        @Min(-18)
        @Max(18)
        private int timezoneOffsetHours = 8;
    }

    @Data
    public static class CacheConfig {
        /**
         * TTL for placeholders that do not carry their own.
         */
        @Min(1)
        private int defaultTtlHours = 12;

        @Valid
        private RedisConfig redis = new RedisConfig();

        @Valid
        private MaintenanceConfig maintenance = new MaintenanceConfig();
    }

    @Data
    public static class RedisConfig {
        /**
         * Keep a copy of each latest version in Redis in front of the table.
         */
        private boolean enabled = false;
    }

    @Data
    public static class MaintenanceConfig {
        private boolean enabled = true;

        private String cron = "0 30 3 * * *";

        /**
         * Expired rows older than this many days are deleted.
         */
        @Min(0)
        private int retentionDays = 7;

        /**
         * Superseded rows older than this many days lose their raw result.
         */
        @Min(0)
        private int compactAfterDays = 7;
    }

    @Data
    public static class QueryConfig {
        /**
         * Identifier of the report data source, part of every cache key.
         */
        @NotBlank
        private String dataSourceId = "default";
    }
}
