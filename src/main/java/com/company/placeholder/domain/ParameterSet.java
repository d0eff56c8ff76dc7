package com.company.placeholder.domain;

import lombok.EqualsAndHashCode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, immutable template parameters shared by every placeholder of a batch.
 * Values are {@link LocalDate}, {@link LocalDateTime} or free-form strings.
 */
@EqualsAndHashCode
public final class ParameterSet {

    public static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final String CURRENT_TIME = "current_time";
    public static final String EXECUTION_TIME = "execution_time";

    // Read from the wall clock at build time, so they differ between otherwise identical runs
    public static final Set<String> WALL_CLOCK_PARAMS = Set.of(CURRENT_TIME, EXECUTION_TIME);

    private final Map<String, Object> values;

    private ParameterSet(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ParameterSet of(Map<String, ?> values) {
        return new ParameterSet(new LinkedHashMap<>(values));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Text form of a value: ISO dates, second-precision date-times, anything else via toString
     */
    public String asText(String name) {
        return render(values.get(name));
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public static String render(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(DATE_TIME);
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return "ParameterSet" + values;
    }
}
