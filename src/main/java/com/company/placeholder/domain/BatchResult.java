package com.company.placeholder.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Per-placeholder outcomes of one batch run, keyed by placeholder name in input order.
 * Built fresh per run and never persisted.
 */
@Value
@Builder
public class BatchResult {
    LocalDate baseDate;
    Map<String, PlaceholderValue> placeholderValues;
    BatchStats stats;

    public PlaceholderValue get(String placeholderName) {
        return placeholderValues.get(placeholderName);
    }

    public int size() {
        return placeholderValues.size();
    }
}
