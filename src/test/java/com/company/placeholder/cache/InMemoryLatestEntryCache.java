package com.company.placeholder.cache;

import com.company.placeholder.domain.CacheEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Front cache kept in a map, standing in for Redis.
 */
class InMemoryLatestEntryCache extends RedisLatestEntryCache {

    final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    InMemoryLatestEntryCache() {
        super(null, null);
    }

    @Override
    public void put(CacheEntry entry, Instant now) {
        entries.put(entry.getCacheKey(), entry);
    }

    @Override
    public Optional<CacheEntry> get(String cacheKey) {
        return Optional.ofNullable(entries.get(cacheKey));
    }

    @Override
    public void evict(Collection<String> cacheKeys) {
        cacheKeys.forEach(entries::remove);
    }
}
