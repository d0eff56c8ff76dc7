package com.company.placeholder.cache;

import com.company.placeholder.config.PlaceholderProperties;
import com.company.placeholder.domain.CacheEntry;
import com.company.placeholder.domain.CacheStatistics;
import com.company.placeholder.domain.CacheWriteContext;
import com.company.placeholder.domain.CacheWriteRequest;
import com.company.placeholder.domain.ParameterSet;
import com.company.placeholder.exception.CacheReadException;
import com.company.placeholder.exception.CacheWriteException;
import com.company.placeholder.repository.PlaceholderCacheRepository;
import com.company.placeholder.util.CacheKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Versioned cache of placeholder values.
 *
 * <p>Each (placeholder, data source) pair has one stable cache key. Every write inserts a new
 * version and demotes the previous latest one for the same placeholder, so readers only ever
 * see a single latest, unexpired, successful row. Reads never change a value; they only count hits.
 *
 * <p>Writes for the same placeholder are serialized by an in-process lock and a transaction.
 * Locks are striped by placeholder id, so their number stays fixed however many placeholders
 * are written; unrelated placeholders only contend when they share a stripe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheVersioningStore {

    private final PlaceholderCacheRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final PlaceholderProperties properties;
    private final Clock clock;
    private final Optional<RedisLatestEntryCache> redisCache;

    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] placeholderLocks = newStripes();

    /**
     * Latest servable version for the pair, counting the read as a hit.
     * Read failures are logged and reported as a miss.
     */
    public Optional<CacheEntry> lookup(String placeholderId, String dataSourceId) {
        String cacheKey = CacheKeys.cacheKey(placeholderId, dataSourceId);
        Instant now = clock.instant();

        try {
            Optional<CacheEntry> cached = redisCache.flatMap(cache -> cache.get(cacheKey));
            if (cached.isPresent() && cached.get().isServableAt(now)
                    && repository.recordHit(cached.get().getEntryId(), now) > 0) {
                return Optional.of(hit(cached.get(), now));
            }

            Optional<CacheEntry> latest = repository.findLatestValid(cacheKey, now);
            if (latest.isEmpty() || repository.recordHit(latest.get().getEntryId(), now) == 0) {
                meterRegistry.counter("placeholder.cache.misses").increment();
                log.debug("Cache miss for placeholder {} on {}", placeholderId, dataSourceId);
                return Optional.empty();
            }
            return Optional.of(hit(latest.get(), now));

        } catch (RuntimeException e) {
            CacheReadException failure = new CacheReadException(cacheKey, e);
            log.warn("{}; treating as miss", failure.getMessage(), e);
            meterRegistry.counter("placeholder.cache.read.failures").increment();
            return Optional.empty();
        }
    }

    /**
     * Stores a new latest version. Without a context the version is addressed by its raw result
     * and carries no batch id.
     *
     * @throws CacheWriteException when the demotion or the insert fails; neither is kept
     */
    public CacheEntry put(String placeholderId, String dataSourceId,
                          CacheWriteRequest request, CacheWriteContext context) {
        Instant now = clock.instant();
        int ttlHours = request.getCacheTtlHours() > 0
                ? request.getCacheTtlHours()
                : properties.getCache().getDefaultTtlHours();

        String versionHash;
        String batchId = null;
        if (context != null) {
            versionHash = CacheKeys.versionHash(context.getFilledSql(),
                    canonicalParameters(placeholderId, context.getSqlParameters()), context.getExecutionTime());
            batchId = CacheKeys.executionBatchId(context.getExecutionTime(), context.getReportPeriod(), placeholderId);
        } else {
            versionHash = CacheKeys.sha256(String.valueOf(request.getRawResult()));
        }

        CacheEntry entry = CacheEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .placeholderId(placeholderId)
                .templateId(request.getTemplateId())
                .dataSourceId(dataSourceId)
                .cacheKey(CacheKeys.cacheKey(placeholderId, dataSourceId))
                .versionHash(versionHash)
                .executionBatchId(batchId)
                .rawResult(request.getRawResult())
                .formattedText(request.getFormattedText())
                .executionSql(request.getExecutionSql())
                .executionTimeMs(request.getExecutionTimeMs())
                .rowCount(request.getRowCount())
                .success(request.isSuccess())
                .createdAt(now)
                .expiresAt(now.plus(Duration.ofHours(ttlHours)))
                .hitCount(0)
                .latestVersion(true)
                .build();

        ReentrantLock lock = lockFor(placeholderId);
        lock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                int demoted = repository.demoteLatest(placeholderId);
                repository.insert(entry);
                log.debug("Demoted {} version(s) of placeholder {}", demoted, placeholderId);
            });
        } catch (RuntimeException e) {
            meterRegistry.counter("placeholder.cache.write.failures").increment();
            throw new CacheWriteException(placeholderId, e);
        } finally {
            lock.unlock();
        }

        redisCache.ifPresent(cache -> cache.put(entry, now));
        meterRegistry.counter("placeholder.cache.writes").increment();

        log.info("Stored cache version {} for placeholder {} (key {}, expires {})",
                entry.getVersionHash(), placeholderId, entry.getCacheKey(), entry.getExpiresAt());
        return entry;
    }

    /**
     * Expires every live row of the template's placeholders. Rows are kept.
     *
     * @return number of rows touched
     */
    public int invalidate(String templateId) {
        Instant now = clock.instant();
        List<String> cacheKeys = repository.findActiveCacheKeysByTemplate(templateId, now);
        int expired = repository.expireByTemplate(templateId, now);

        redisCache.ifPresent(cache -> cache.evict(cacheKeys));

        log.info("Invalidated {} cache row(s) of template {}", expired, templateId);
        return expired;
    }

    /**
     * Aggregates over all rows; either filter may be null
     */
    public CacheStatistics statistics(String templateId, String dataSourceId) {
        return repository.aggregateStatistics(templateId, dataSourceId, clock.instant());
    }

    public List<CacheEntry> history(String placeholderId) {
        return repository.findByPlaceholder(placeholderId);
    }

    public long countLatestValid() {
        return repository.countLatestValid(clock.instant());
    }

    ReentrantLock lockFor(String placeholderId) {
        return placeholderLocks[Math.floorMod(placeholderId.hashCode(), LOCK_STRIPES)];
    }

    // Hit count is re-read after the increment; a front-cache copy carries its write-time count
    private CacheEntry hit(CacheEntry entry, Instant now) {
        int hitCount = repository.findHitCount(entry.getEntryId()).orElse(entry.getHitCount() + 1);
        meterRegistry.counter("placeholder.cache.hits").increment();
        log.debug("Cache hit for placeholder {} (version {}, {} hit(s))",
                entry.getPlaceholderId(), entry.getVersionHash(), hitCount);
        return entry.toBuilder()
                .hitCount(hitCount)
                .lastHitAt(now)
                .build();
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    /**
     * Sorted text rendering so equal parameter sets hash equally regardless of insertion order.
     * Wall-clock parameters are left out; the run's time enters the hash as the execution time.
     */
    private String canonicalParameters(String placeholderId, ParameterSet parameters) {
        if (parameters == null) {
            return "{}";
        }
        Map<String, String> rendered = new TreeMap<>();
        parameters.asMap().forEach((name, value) -> {
            if (!ParameterSet.WALL_CLOCK_PARAMS.contains(name)) {
                rendered.put(name, ParameterSet.render(value));
            }
        });
        try {
            return objectMapper.writeValueAsString(rendered);
        } catch (JsonProcessingException e) {
            throw new CacheWriteException(placeholderId, e);
        }
    }
}
