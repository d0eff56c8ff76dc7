package com.company.placeholder.domain;

import lombok.EqualsAndHashCode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human-readable placeholder name. The substring rules below decide how a value
 * is computed and rendered, so they are kept exactly as the report authors use them.
 */
@EqualsAndHashCode
public final class DisplayName {

    private static final Pattern TASK_TIME_OFFSET = Pattern.compile("任务时间\\s*(前|后)\\s*(\\d+)\\s*天");

    private final String value;

    private DisplayName(String value) {
        this.value = value == null ? "" : value;
    }

    public static DisplayName of(String value) {
        return new DisplayName(value);
    }

    public String getValue() {
        return value;
    }

    // ---- rendering ---------------------------------------------------------

    public boolean isPercentage() {
        return value.contains("占比") || value.contains("百分比");
    }

    public boolean isChart() {
        return value.contains("图表");
    }

    public boolean formatsAsPercentage() {
        return isPercentage() && !isChart();
    }

    // ---- period rules, in match priority order -----------------------------

    public boolean isTaskStartTime() {
        return value.contains("任务开始时间");
    }

    /**
     * Signed day offset for "N days before/after the task time" names
     */
    public Optional<Integer> taskTimeOffsetDays() {
        Matcher matcher = TASK_TIME_OFFSET.matcher(value);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int days = Integer.parseInt(matcher.group(2));
        return Optional.of("前".equals(matcher.group(1)) ? -days : days);
    }

    public boolean isYearMonthDay() {
        return value.contains("年月日");
    }

    public boolean isMonthDay() {
        return value.contains("月日");
    }

    public boolean isYesterday() {
        return value.contains("昨天");
    }

    public boolean isTomorrow() {
        return value.contains("明天");
    }

    @Override
    public String toString() {
        return value;
    }
}
