package com.company.placeholder.service;

import com.company.placeholder.cache.CacheVersioningStore;
import com.company.placeholder.config.PlaceholderProperties;
import com.company.placeholder.domain.BatchResult;
import com.company.placeholder.domain.BatchStats;
import com.company.placeholder.domain.CacheEntry;
import com.company.placeholder.domain.CacheWriteContext;
import com.company.placeholder.domain.CacheWriteRequest;
import com.company.placeholder.domain.ExecutionContext;
import com.company.placeholder.domain.ParameterSet;
import com.company.placeholder.domain.PlaceholderSpec;
import com.company.placeholder.domain.PlaceholderValue;
import com.company.placeholder.domain.TabularResult;
import com.company.placeholder.domain.enums.PlaceholderState;
import com.company.placeholder.exception.CacheWriteException;
import com.company.placeholder.query.QueryRunner;
import com.company.placeholder.query.ResultUnpacker;
import com.company.placeholder.query.ValueFormatter;
import com.company.placeholder.template.FillResult;
import com.company.placeholder.template.SqlTemplateFiller;
import com.company.placeholder.template.TemplateParameterBuilder;
import com.company.placeholder.template.TemplateValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Computes the values of many placeholders for one task run.
 *
 * <p>Period placeholders are resolved first on the calling thread. SQL placeholders are
 * validated, then run on a pool of at most {@code maxConcurrency} threads; each one checks the
 * cache, and on a miss fills its template, executes it, shapes the rows and stores a new version.
 * A failing placeholder becomes a FAILED entry and never aborts the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchExecutor {

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final QueryRunner queryRunner;
    private final SqlTemplateFiller templateFiller;
    private final TemplateParameterBuilder parameterBuilder;
    private final CacheVersioningStore cacheStore;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final PlaceholderProperties properties;
    private final Clock clock;

    public BatchResult run(List<PlaceholderSpec> placeholders, LocalDate baseDate, ExecutionContext context) {
        return run(placeholders, baseDate, context, Map.of(), properties.getBatch().getMaxConcurrency());
    }

    /**
     * @param context the task run, or null for an ad-hoc run that neither reads nor writes the cache
     * @return one entry per distinct placeholder name, in input order
     */
    public BatchResult run(List<PlaceholderSpec> placeholders, LocalDate baseDate, ExecutionContext context,
                           Map<String, ?> additionalParams, int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        long startTime = System.currentTimeMillis();

        // Batch-wide failures surface here, before any placeholder work
        ParameterSet params = parameterBuilder.build(baseDate,
                properties.getTemplate().getTimezoneOffsetHours(), additionalParams);

        Map<String, PlaceholderSpec> specs = new LinkedHashMap<>();
        for (PlaceholderSpec spec : placeholders) {
            if (specs.putIfAbsent(spec.getName(), spec) != null) {
                log.warn("Duplicate placeholder '{}' in batch; keeping the first definition", spec.getName());
            }
        }

        log.info("Starting batch of {} placeholder(s) for base date {} (max concurrency {}, cache {})",
                specs.size(), baseDate, maxConcurrency, context != null ? "on" : "off");

        Map<String, PlaceholderValue> resolved = new HashMap<>();
        List<PlaceholderSpec> queries = new ArrayList<>();
        int periodCount = 0;
        int sqlCount = 0;

        for (PlaceholderSpec spec : specs.values()) {
            if (spec.isPeriod()) {
                periodCount++;
                resolved.put(spec.getName(), resolvePeriod(spec, baseDate));
                continue;
            }

            sqlCount++;
            if (!spec.hasSqlTemplate()) {
                log.error("Placeholder '{}' has no SQL template", spec.getName());
                resolved.put(spec.getName(),
                        new StateTrail(spec.getName()).finish(PlaceholderValue.failed("SQL template is empty", 0)));
                continue;
            }

            TemplateValidationResult validation = templateFiller.validate(spec.getSqlTemplate());
            if (!validation.isValid()) {
                log.error("Placeholder '{}' has an invalid SQL template: {}", spec.getName(), validation.getIssues());
                resolved.put(spec.getName(), new StateTrail(spec.getName()).finish(PlaceholderValue.failed(
                        "Invalid SQL template: " + String.join("; ", validation.getIssues()), 0)));
                continue;
            }
            validation.getWarnings().forEach(warning ->
                    log.warn("Placeholder '{}': {}", spec.getName(), warning));
            queries.add(spec);
        }

        if (!queries.isEmpty()) {
            resolved.putAll(runQueries(queries, params, context, Math.min(maxConcurrency, queries.size())));
        }

        Map<String, PlaceholderValue> values = new LinkedHashMap<>();
        specs.keySet().forEach(name -> values.put(name, resolved.get(name)));

        long executionTimeMs = System.currentTimeMillis() - startTime;
        BatchStats stats = BatchStats.builder()
                .total(values.size())
                .periodCount(periodCount)
                .sqlCount(sqlCount)
                .successCount((int) values.values().stream().filter(PlaceholderValue::hasUsableValue).count())
                .failCount((int) values.values().stream().filter(v -> !v.isSuccess()).count())
                .cacheHitCount((int) values.values().stream().filter(PlaceholderValue::isCacheHit).count())
                .executionTimeMs(executionTimeMs)
                .build();

        meterRegistry.timer("placeholder.batch.duration").record(executionTimeMs, TimeUnit.MILLISECONDS);

        log.info("Batch finished in {}ms: {} succeeded, {} failed, {} from cache",
                executionTimeMs, stats.getSuccessCount(), stats.getFailCount(), stats.getCacheHitCount());

        return BatchResult.builder()
                .baseDate(baseDate)
                .placeholderValues(values)
                .stats(stats)
                .build();
    }

    private PlaceholderValue resolvePeriod(PlaceholderSpec spec, LocalDate baseDate) {
        StateTrail trail = new StateTrail(spec.getName());
        long start = System.currentTimeMillis();
        try {
            String value = templateFiller.computePeriodValue(spec.getName(), baseDate);
            trail.to(PlaceholderState.PERIOD_COMPUTED);
            return trail.finish(PlaceholderValue.period(value, System.currentTimeMillis() - start));
        } catch (RuntimeException e) {
            log.error("Period placeholder '{}' failed: {}", spec.getName(), e.getMessage());
            return trail.finish(PlaceholderValue.failed(e.getMessage(), System.currentTimeMillis() - start));
        }
    }

    private Map<String, PlaceholderValue> runQueries(List<PlaceholderSpec> queries, ParameterSet params,
                                                     ExecutionContext context, int poolSize) {
        ExecutorService pool = Executors.newFixedThreadPool(poolSize,
                new CustomizableThreadFactory("placeholder-query-"));
        try {
            Map<String, CompletableFuture<PlaceholderValue>> futures = new LinkedHashMap<>();
            for (PlaceholderSpec spec : queries) {
                futures.put(spec.getName(),
                        CompletableFuture.supplyAsync(() -> resolveQuery(spec, params, context), pool));
            }

            Map<String, PlaceholderValue> results = new HashMap<>();
            futures.forEach((name, future) -> results.put(name, future.join()));
            return results;
        } finally {
            pool.shutdown();
        }
    }

    private PlaceholderValue resolveQuery(PlaceholderSpec spec, ParameterSet params, ExecutionContext context) {
        StateTrail trail = new StateTrail(spec.getName());
        long start = System.currentTimeMillis();
        String dataSourceId = queryRunner.getDataSourceId();
        boolean cacheable = context != null && spec.getPlaceholderId() != null;

        try {
            if (cacheable) {
                Optional<CacheEntry> cached = cacheStore.lookup(spec.getPlaceholderId(), dataSourceId);
                if (cached.isPresent()) {
                    trail.to(PlaceholderState.CACHE_HIT);
                    return trail.finish(PlaceholderValue.fromCache(
                            valueOf(spec, cached.get()), System.currentTimeMillis() - start));
                }
            }

            FillResult fill = templateFiller.fill(spec.getSqlTemplate(), params);
            if (!fill.isComplete()) {
                log.warn("Placeholder '{}' runs with unfilled parameters {}", spec.getName(), fill.getMissingKeys());
            }

            trail.to(PlaceholderState.QUERY_RUNNING);
            List<Map<String, Object>> rows = queryRunner.execute(fill.getSql());
            TabularResult result = ResultUnpacker.unpack(rows);
            Object value = ValueFormatter.format(spec.getDisplayName(), result);
            long elapsed = System.currentTimeMillis() - start;

            log.debug("Placeholder '{}' resolved to a {} in {}ms", spec.getName(), result.getShape(), elapsed);

            if (cacheable) {
                store(spec, dataSourceId, rows, value, fill.getSql(), params, context, elapsed);
            }
            return trail.finish(PlaceholderValue.fromQuery(value, elapsed));

        } catch (RuntimeException e) {
            log.error("Placeholder '{}' failed: {}", spec.getName(), e.getMessage());
            meterRegistry.counter("placeholder.query.failures").increment();
            return trail.finish(PlaceholderValue.failed(e.getMessage(), System.currentTimeMillis() - start));
        }
    }

    /**
     * Writes a new cache version. A failed write only costs a future recomputation, so the
     * placeholder keeps its computed value.
     */
    private void store(PlaceholderSpec spec, String dataSourceId, List<Map<String, Object>> rows, Object value,
                       String filledSql, ParameterSet params, ExecutionContext context, long elapsed) {
        try {
            CacheWriteRequest request = CacheWriteRequest.builder()
                    .templateId(spec.getTemplateId())
                    .rawResult(objectMapper.writeValueAsString(rows))
                    .formattedText(formattedText(value))
                    .executionSql(filledSql)
                    .executionTimeMs(elapsed)
                    .rowCount(rows == null ? 0 : rows.size())
                    .cacheTtlHours(spec.getCacheTtlHours())
                    .build();

            CacheWriteContext writeContext = CacheWriteContext.builder()
                    .executionTime(executionTime(context, params))
                    .reportPeriod(params.asText("start_date") + "_to_" + params.asText("end_date"))
                    .filledSql(filledSql)
                    .sqlParameters(params)
                    .build();

            cacheStore.put(spec.getPlaceholderId(), dataSourceId, request, writeContext);

        } catch (JsonProcessingException | CacheWriteException e) {
            log.warn("Placeholder '{}' computed but not cached: {}", spec.getName(), e.getMessage());
        }
    }

    /**
     * Re-derives the value from the cached rows so shaping and formatting rules apply to hits
     * exactly as to fresh results. Compacted rows fall back to the stored text.
     */
    private Object valueOf(PlaceholderSpec spec, CacheEntry entry) {
        if (entry.getRawResult() != null) {
            try {
                List<Map<String, Object>> rows = objectMapper.readerFor(ROWS)
                        .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                        .readValue(entry.getRawResult());
                return ValueFormatter.format(spec.getDisplayName(), ResultUnpacker.unpack(rows));
            } catch (JsonProcessingException e) {
                log.warn("Cached rows of placeholder '{}' are unreadable, using stored text: {}",
                        spec.getName(), e.getMessage());
            }
        }
        return entry.getFormattedText();
    }

    private String formattedText(Object value) throws JsonProcessingException {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof List) {
            return objectMapper.writeValueAsString(value);
        }
        return ParameterSet.render(value);
    }

    private LocalDateTime executionTime(ExecutionContext context, ParameterSet params) {
        if (context.getNominalTime() != null) {
            return context.getNominalTime();
        }
        Object executionTime = params.get(ParameterSet.EXECUTION_TIME);
        return executionTime instanceof LocalDateTime
                ? (LocalDateTime) executionTime
                : LocalDateTime.now(clock);
    }

    /**
     * States one placeholder passes through, logged at debug as they happen.
     */
    private static final class StateTrail {

        private final String name;
        private final List<PlaceholderState> states = new ArrayList<>();

        StateTrail(String name) {
            this.name = name;
            states.add(PlaceholderState.PENDING);
        }

        void to(PlaceholderState next) {
            log.debug("Placeholder '{}': {} -> {} ({})",
                    name, states.get(states.size() - 1), next, next.getDescription());
            states.add(next);
        }

        PlaceholderValue finish(PlaceholderValue value) {
            to(value.getState());
            return value.toBuilder()
                    .transitions(List.copyOf(states))
                    .build();
        }
    }
}
