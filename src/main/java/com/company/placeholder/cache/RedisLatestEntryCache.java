package com.company.placeholder.cache;

import com.company.placeholder.domain.CacheEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Write-through copy of the latest cache version per cache key.
 * The table stays authoritative; every Redis failure degrades to a table read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "placeholder.cache.redis.enabled", havingValue = "true")
public class RedisLatestEntryCache {

    static final String LATEST_ENTRY = "placeholder:latest:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Caches the entry until it expires in the table
     */
    public void put(CacheEntry entry, Instant now) {
        try {
            Duration ttl = Duration.between(now, entry.getExpiresAt());
            if (ttl.isNegative() || ttl.isZero()) {
                return;
            }

            redisTemplate.opsForValue().set(
                    LATEST_ENTRY + entry.getCacheKey(),
                    objectMapper.writeValueAsString(entry),
                    ttl);

            log.debug("Cached latest entry {} for key {} with TTL {}",
                    entry.getEntryId(), entry.getCacheKey(), ttl);

        } catch (Exception e) {
            log.warn("Failed to cache latest entry in Redis: {}", e.getMessage());
            // Non-fatal - lookups fall back to the table
        }
    }

    /**
     * Returns empty Optional on cache miss (caller queries the table)
     */
    public Optional<CacheEntry> get(String cacheKey) {
        try {
            String json = redisTemplate.opsForValue().get(LATEST_ENTRY + cacheKey);
            if (json == null) {
                return Optional.empty();
            }

            log.debug("REDIS HIT: latest entry for key {}", cacheKey);
            return Optional.of(objectMapper.readValue(json, CacheEntry.class));

        } catch (Exception e) {
            log.warn("Failed to read latest entry from Redis: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void evict(Collection<String> cacheKeys) {
        if (cacheKeys.isEmpty()) {
            return;
        }
        try {
            List<String> keys = cacheKeys.stream()
                    .map(key -> LATEST_ENTRY + key)
                    .collect(Collectors.toList());
            Long removed = redisTemplate.delete(keys);
            log.debug("Evicted {} latest entries from Redis", removed);
        } catch (Exception e) {
            log.warn("Failed to evict latest entries from Redis: {}", e.getMessage());
        }
    }
}
