package com.company.placeholder.repository;

import com.company.placeholder.domain.CacheEntry;
import com.company.placeholder.domain.CacheStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row store for placeholder cache versions. Transaction boundaries belong to the caller.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class PlaceholderCacheRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT entry_id, placeholder_id, template_id, data_source_id, cache_key,
               version_hash, execution_batch_id,
               raw_result, formatted_text, execution_sql, execution_time_ms, row_count,
               success, created_at, expires_at, hit_count, last_hit_at, is_latest_version
        FROM placeholder_cache_entries
        """;

    /**
     * The servable version for a cache key: successful, latest and not yet expired
     */
    public Optional<CacheEntry> findLatestValid(String cacheKey, Instant now) {
        String sql = SELECT_BASE + """
            WHERE cache_key = ?
              AND success = TRUE
              AND is_latest_version = TRUE
              AND expires_at > ?
            ORDER BY created_at DESC
            LIMIT 1
            """;

        List<CacheEntry> results = jdbcTemplate.query(sql, new CacheEntryRowMapper(), cacheKey, Timestamp.from(now));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * All versions of a placeholder, newest first
     */
    public List<CacheEntry> findByPlaceholder(String placeholderId) {
        String sql = SELECT_BASE + " WHERE placeholder_id = ? ORDER BY created_at DESC, entry_id DESC";
        return jdbcTemplate.query(sql, new CacheEntryRowMapper(), placeholderId);
    }

    /**
     * Counts a read against a still-servable row. Returns 0 when the row was superseded or expired meanwhile.
     */
    public int recordHit(String entryId, Instant now) {
        return jdbcTemplate.update("""
            UPDATE placeholder_cache_entries
            SET hit_count = hit_count + 1,
                last_hit_at = ?
            WHERE entry_id = ?
              AND is_latest_version = TRUE
              AND expires_at > ?
            """, Timestamp.from(now), entryId, Timestamp.from(now));
    }

    public Optional<Integer> findHitCount(String entryId) {
        List<Integer> counts = jdbcTemplate.queryForList(
                "SELECT hit_count FROM placeholder_cache_entries WHERE entry_id = ?", Integer.class, entryId);
        return counts.isEmpty() ? Optional.empty() : Optional.ofNullable(counts.get(0));
    }

    public int demoteLatest(String placeholderId) {
        return jdbcTemplate.update("""
            UPDATE placeholder_cache_entries
            SET is_latest_version = FALSE
            WHERE placeholder_id = ?
              AND is_latest_version = TRUE
            """, placeholderId);
    }

    public void insert(CacheEntry entry) {
        jdbcTemplate.update("""
            INSERT INTO placeholder_cache_entries (
                entry_id, placeholder_id, template_id, data_source_id, cache_key,
                version_hash, execution_batch_id,
                raw_result, formatted_text, execution_sql, execution_time_ms, row_count,
                success, created_at, expires_at, hit_count, last_hit_at, is_latest_version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
                entry.getEntryId(),
                entry.getPlaceholderId(),
                entry.getTemplateId(),
                entry.getDataSourceId(),
                entry.getCacheKey(),
                entry.getVersionHash(),
                entry.getExecutionBatchId(),
                entry.getRawResult(),
                entry.getFormattedText(),
                entry.getExecutionSql(),
                entry.getExecutionTimeMs(),
                entry.getRowCount(),
                entry.isSuccess(),
                Timestamp.from(entry.getCreatedAt()),
                Timestamp.from(entry.getExpiresAt()),
                entry.getHitCount(),
                entry.getLastHitAt() != null ? Timestamp.from(entry.getLastHitAt()) : null,
                entry.isLatestVersion()
        );
    }

    public List<String> findActiveCacheKeysByTemplate(String templateId, Instant now) {
        return jdbcTemplate.queryForList("""
            SELECT DISTINCT cache_key FROM placeholder_cache_entries
            WHERE template_id = ?
              AND expires_at > ?
            """, String.class, templateId, Timestamp.from(now));
    }

    /**
     * Soft invalidation: rows stay, their expiry moves to now
     */
    public int expireByTemplate(String templateId, Instant now) {
        return jdbcTemplate.update("""
            UPDATE placeholder_cache_entries
            SET expires_at = ?
            WHERE template_id = ?
              AND expires_at > ?
            """, Timestamp.from(now), templateId, Timestamp.from(now));
    }

    public int deleteExpiredBefore(Instant threshold) {
        return jdbcTemplate.update(
                "DELETE FROM placeholder_cache_entries WHERE expires_at < ?",
                Timestamp.from(threshold));
    }

    /**
     * Drops raw results of superseded versions; formatted text is kept
     */
    public int compactSupersededBefore(Instant threshold) {
        return jdbcTemplate.update("""
            UPDATE placeholder_cache_entries
            SET raw_result = NULL
            WHERE is_latest_version = FALSE
              AND created_at < ?
              AND raw_result IS NOT NULL
            """, Timestamp.from(threshold));
    }

    public long countLatestValid(Instant now) {
        Long count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM placeholder_cache_entries
            WHERE is_latest_version = TRUE
              AND expires_at > ?
            """, Long.class, Timestamp.from(now));
        return count != null ? count : 0;
    }

    public CacheStatistics aggregateStatistics(String templateId, String dataSourceId, Instant now) {
        StringBuilder sql = new StringBuilder("""
            SELECT COUNT(*) AS total_entries,
                   COALESCE(SUM(CASE WHEN expires_at > ? THEN 1 ELSE 0 END), 0) AS valid_entries,
                   COALESCE(SUM(hit_count), 0) AS total_hits,
                   AVG(execution_time_ms) AS avg_execution_time_ms
            FROM placeholder_cache_entries
            WHERE 1 = 1
            """);

        List<Object> params = new ArrayList<>();
        params.add(Timestamp.from(now));

        if (templateId != null) {
            sql.append(" AND template_id = ?");
            params.add(templateId);
        }
        if (dataSourceId != null) {
            sql.append(" AND data_source_id = ?");
            params.add(dataSourceId);
        }

        Map<String, Object> row = jdbcTemplate.queryForMap(sql.toString(), params.toArray());

        long total = getLong(row, "total_entries");
        long valid = getLong(row, "valid_entries");
        long hits = getLong(row, "total_hits");
        double hitRate = total > 0
                ? BigDecimal.valueOf(hits * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue()
                : 0.0;
        double avgExecution = BigDecimal.valueOf(getDouble(row, "avg_execution_time_ms"))
                .setScale(2, RoundingMode.HALF_UP).doubleValue();

        return CacheStatistics.builder()
                .totalEntries(total)
                .validEntries(valid)
                .expiredEntries(total - valid)
                .totalHits(hits)
                .cacheHitRate(hitRate)
                .avgExecutionTimeMs(avgExecution)
                .build();
    }

    private static long getLong(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    private static class CacheEntryRowMapper implements RowMapper<CacheEntry> {
        @Override
        public CacheEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CacheEntry.builder()
                    .entryId(rs.getString("entry_id"))
                    .placeholderId(rs.getString("placeholder_id"))
                    .templateId(rs.getString("template_id"))
                    .dataSourceId(rs.getString("data_source_id"))
                    .cacheKey(rs.getString("cache_key"))
                    .versionHash(rs.getString("version_hash"))
                    .executionBatchId(rs.getString("execution_batch_id"))
                    .rawResult(rs.getString("raw_result"))
                    .formattedText(rs.getString("formatted_text"))
                    .executionSql(rs.getString("execution_sql"))
                    .executionTimeMs(rs.getObject("execution_time_ms", Long.class))
                    .rowCount(rs.getObject("row_count", Integer.class))
                    .success(rs.getBoolean("success"))
                    .createdAt(getInstant(rs, "created_at"))
                    .expiresAt(getInstant(rs, "expires_at"))
                    .hitCount(rs.getInt("hit_count"))
                    .lastHitAt(getInstant(rs, "last_hit_at"))
                    .latestVersion(rs.getBoolean("is_latest_version"))
                    .build();
        }

        private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
