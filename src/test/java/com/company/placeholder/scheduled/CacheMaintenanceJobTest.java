package com.company.placeholder.scheduled;

import com.company.placeholder.cache.CacheVersioningStore;
import com.company.placeholder.config.PlaceholderProperties;
import com.company.placeholder.domain.CacheEntry;
import com.company.placeholder.domain.CacheWriteRequest;
import com.company.placeholder.repository.PlaceholderCacheRepository;
import com.company.placeholder.support.CacheTestDatabase;
import com.company.placeholder.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CacheMaintenanceJobTest {

    private CacheTestDatabase db;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private CacheVersioningStore store;
    private CacheMaintenanceJob job;

    @BeforeEach
    void setUp() {
        db = new CacheTestDatabase();
        clock = MutableClock.at("2024-06-01T00:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        PlaceholderProperties properties = new PlaceholderProperties();
        PlaceholderCacheRepository repository = new PlaceholderCacheRepository(db.jdbcTemplate());

        store = new CacheVersioningStore(repository, db.transactionTemplate(), new ObjectMapper(),
                meterRegistry, properties, clock, Optional.empty());
        job = new CacheMaintenanceJob(repository, properties, meterRegistry, clock);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private CacheEntry put(String placeholderId, int ttlHours) {
        return store.put(placeholderId, "reports", CacheWriteRequest.builder()
                .templateId("tpl")
                .rawResult("[{\"v\":1}]")
                .formattedText("1")
                .cacheTtlHours(ttlHours)
                .build(), null);
    }

    @Test
    @DisplayName("rows expired longer than the retention period are deleted")
    void purgesOldExpiredRows() {
        put("ph-old", 1);
        clock.advance(Duration.ofDays(9));
        put("ph-recent", 1);
        clock.advance(Duration.ofDays(1));

        assertEquals(1, job.purgeExpired());

        assertEquals(0, db.count("placeholder_id = ?", "ph-old"));
        assertEquals(1, db.count("placeholder_id = ?", "ph-recent"));
    }

    @Test
    @DisplayName("old superseded rows lose their raw result, the latest keeps it")
    void compactsSupersededRows() {
        put("ph-1", 24 * 30);
        clock.advance(Duration.ofDays(8));
        CacheEntry latest = put("ph-1", 24 * 30);

        assertEquals(1, job.compactSuperseded());

        assertEquals(1, db.count("placeholder_id = ? AND raw_result IS NULL AND formatted_text = '1'", "ph-1"));
        assertEquals(1, db.count("entry_id = ? AND raw_result IS NOT NULL", latest.getEntryId()));
        assertEquals(0, job.compactSuperseded());
    }

    @Test
    @DisplayName("the latest unexpired version survives a full run")
    void latestUntouched() {
        CacheEntry latest = put("ph-1", 24 * 365);
        clock.advance(Duration.ofDays(30));

        job.runMaintenance();

        assertEquals(1, db.count("entry_id = ? AND raw_result IS NOT NULL", latest.getEntryId()));
        assertTrue(store.lookup("ph-1", "reports").isPresent());
    }

    @Test
    @DisplayName("database failures are logged and counted")
    void failuresAreCounted() {
        db.jdbcTemplate().execute("DROP TABLE placeholder_cache_entries");

        assertEquals(0, job.purgeExpired());
        assertEquals(0, job.compactSuperseded());
        assertEquals(2.0, meterRegistry.counter("placeholder.cache.maintenance.failures").count());
    }
}
