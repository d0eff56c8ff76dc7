package com.company.placeholder.domain;

import com.company.placeholder.domain.enums.PlaceholderState;
import com.company.placeholder.domain.enums.ValueSource;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome for one placeholder of a batch.
 */
@Value
@Builder(toBuilder = true)
public class PlaceholderValue {

    public static final String ERROR_PREFIX = "ERROR: ";

    boolean success;
    Object value;
    ValueSource source;
    long executionTimeMs;
    boolean cacheHit;
    PlaceholderState state;

    // States passed through, from PENDING to the final one
    @Builder.Default
    List<PlaceholderState> transitions = List.of();

    public boolean isErrorMarker() {
        return value instanceof String && ((String) value).startsWith(ERROR_PREFIX);
    }

    /**
     * Counted as a success in batch statistics: a value is present and it is not an error marker
     */
    public boolean hasUsableValue() {
        return value != null && !isErrorMarker();
    }

    public static PlaceholderValue period(Object value, long executionTimeMs) {
        return PlaceholderValue.builder()
                .success(true)
                .value(value)
                .source(ValueSource.PERIOD)
                .executionTimeMs(executionTimeMs)
                .state(PlaceholderState.DONE)
                .build();
    }

    public static PlaceholderValue fromCache(Object value, long executionTimeMs) {
        return PlaceholderValue.builder()
                .success(true)
                .value(value)
                .source(ValueSource.CACHE)
                .executionTimeMs(executionTimeMs)
                .cacheHit(true)
                .state(PlaceholderState.DONE)
                .build();
    }

    public static PlaceholderValue fromQuery(Object value, long executionTimeMs) {
        return PlaceholderValue.builder()
                .success(true)
                .value(value)
                .source(ValueSource.QUERY)
                .executionTimeMs(executionTimeMs)
                .state(PlaceholderState.DONE)
                .build();
    }

    public static PlaceholderValue failed(String error, long executionTimeMs) {
        return PlaceholderValue.builder()
                .success(false)
                .value(ERROR_PREFIX + error)
                .source(ValueSource.ERROR)
                .executionTimeMs(executionTimeMs)
                .state(PlaceholderState.FAILED)
                .build();
    }
}
