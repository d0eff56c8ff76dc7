package com.company.placeholder.template;

import com.company.placeholder.domain.ParameterSet;
import com.company.placeholder.exception.InvalidDateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the template parameter set from a base date.
 * Everything except current_time and execution_time is a pure function of the inputs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateParameterBuilder {

    public static final DateTimeFormatter LONG_DATE_CN = DateTimeFormatter.ofPattern("yyyy年M月d日");
    public static final DateTimeFormatter SHORT_DATE_CN = DateTimeFormatter.ofPattern("M月d日");

    public static final int DEFAULT_TIMEZONE_OFFSET_HOURS = 8;

    private final Clock clock;

    public ParameterSet build(String baseDate) {
        return build(parseBaseDate(baseDate), DEFAULT_TIMEZONE_OFFSET_HOURS, Map.of());
    }

    public ParameterSet build(String baseDate, int timezoneOffsetHours, Map<String, ?> additionalParams) {
        return build(parseBaseDate(baseDate), timezoneOffsetHours, additionalParams);
    }

    public ParameterSet build(LocalDate baseDate, int timezoneOffsetHours, Map<String, ?> additionalParams) {
        if (baseDate == null) {
            throw new InvalidDateException("null");
        }

        Map<String, Object> params = new LinkedHashMap<>();

        // Data window: the base date itself
        params.put("start_date", baseDate);
        params.put("end_date", baseDate);
        params.put("base_date", baseDate);
        params.put("prev_date", baseDate.minusDays(1));
        params.put("next_date", baseDate.plusDays(1));

        params.put("start_datetime", baseDate.atStartOfDay());
        params.put("end_datetime", LocalDateTime.of(baseDate, LocalTime.of(23, 59, 59)));

        // Monday-based week
        LocalDate weekStart = baseDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        params.put("week_start", weekStart);
        params.put("week_end", weekStart.plusDays(6));

        LocalDate monthStart = baseDate.withDayOfMonth(1);
        params.put("month_start", monthStart);
        params.put("month_end", monthStart.plusMonths(1).minusDays(1));

        LocalDate prevMonthStart = monthStart.minusMonths(1);
        params.put("prev_month_start", prevMonthStart);
        params.put("prev_month_end", monthStart.minusDays(1));

        params.put("year_start", baseDate.withDayOfYear(1));
        params.put("year_end", LocalDate.of(baseDate.getYear(), 12, 31));

        params.put("year", String.valueOf(baseDate.getYear()));
        params.put("month", String.format("%02d", baseDate.getMonthValue()));
        params.put("day", String.format("%02d", baseDate.getDayOfMonth()));
        params.put("year_month", String.format("%d-%02d", baseDate.getYear(), baseDate.getMonthValue()));

        // Localized renderings used directly in report text
        params.put("base_date_cn", baseDate.format(LONG_DATE_CN));
        params.put("base_month_day_cn", baseDate.format(SHORT_DATE_CN));
        params.put("prev_date_cn", baseDate.minusDays(1).format(LONG_DATE_CN));

        // Wall clock, exempt from determinism
        LocalDateTime now = LocalDateTime.now(clock.withZone(ZoneOffset.ofHours(timezoneOffsetHours)));
        params.put(ParameterSet.CURRENT_TIME, now);
        params.put(ParameterSet.EXECUTION_TIME, now);

        if (additionalParams != null && !additionalParams.isEmpty()) {
            params.putAll(additionalParams);
            log.debug("Applied {} additional template parameters", additionalParams.size());
        }

        return ParameterSet.of(params);
    }

    private LocalDate parseBaseDate(String baseDate) {
        if (baseDate == null || baseDate.isBlank()) {
            throw new InvalidDateException(String.valueOf(baseDate));
        }
        try {
            return LocalDate.parse(baseDate.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateException(baseDate, e);
        }
    }
}
