package com.company.placeholder.time;

import com.company.placeholder.domain.ExecutionContext;
import com.company.placeholder.domain.TimeInferenceResult;
import com.company.placeholder.domain.enums.CronFieldType;
import com.company.placeholder.domain.enums.CronFrequency;
import com.company.placeholder.exception.InvalidCronException;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Derives the base date of a task run from its cron schedule.
 * CPU only; the same (expression, nominal time) always yields the same result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimeInferenceEngine {

    static final double TEST_MODE_CONFIDENCE = 1.0;

    private static final CronParser UNIX_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final Clock clock;

    public TimeInferenceResult infer(String cronExpression, LocalDateTime nominalTime) {
        CronSchedule schedule = parse(cronExpression);
        CronFrequency frequency = inferFrequency(schedule);

        LocalDateTime executionTime = nominalTime != null ? nominalTime : LocalDateTime.now(clock);
        int lagDays = frequency.getDataLagDays();
        LocalDate baseDate = executionTime.toLocalDate().plusDays(lagDays);

        String explanation = String.format(
                "Cron '%s' runs %s; data period lags %d day(s) behind execution at %s",
                schedule.getExpression(), frequency, -lagDays, executionTime);

        log.debug("Inferred base date {} from cron '{}' ({}, confidence {})",
                baseDate, cronExpression, frequency, frequency.getConfidence());

        return TimeInferenceResult.builder()
                .baseDate(baseDate)
                .frequency(frequency)
                .dataLagDays(lagDays)
                .confidence(frequency.getConfidence())
                .explanation(explanation)
                .cronExpression(schedule.getExpression())
                .testMode(false)
                .build();
    }

    /**
     * Fixed, schedule-independent base date for validation runs
     */
    public TimeInferenceResult testMode(LocalDate fixedDate, int daysOffset) {
        LocalDate baseDate = fixedDate != null
                ? fixedDate
                : LocalDate.now(clock).plusDays(daysOffset);

        String explanation = fixedDate != null
                ? "Test mode: fixed base date " + fixedDate
                : String.format("Test mode: today offset by %d day(s)", daysOffset);

        return TimeInferenceResult.builder()
                .baseDate(baseDate)
                .frequency(CronFrequency.DAILY)
                .dataLagDays(fixedDate != null ? 0 : daysOffset)
                .confidence(TEST_MODE_CONFIDENCE)
                .explanation(explanation)
                .testMode(true)
                .build();
    }

    public TimeInferenceResult resolve(ExecutionContext context) {
        if (context.isTestMode()) {
            return testMode(context.getFixedTestDate(), context.getTestDaysOffset());
        }
        if (context.getCronExpression() == null || context.getCronExpression().isBlank()) {
            throw new InvalidCronException(String.valueOf(context.getCronExpression()),
                    "a cron expression is required outside test mode");
        }
        return infer(context.getCronExpression(), context.getNominalTime());
    }

    public CronSchedule parse(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidCronException(String.valueOf(cronExpression), "expression is empty");
        }

        String normalized = cronExpression.trim();
        String[] fields = normalized.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidCronException(cronExpression,
                    "expected 5 fields (minute hour day month weekday), got " + fields.length);
        }

        try {
            UNIX_PARSER.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidCronException(cronExpression, e.getMessage(), e);
        }

        return new CronSchedule(String.join(" ", fields), fields[0], fields[1], fields[2], fields[3], fields[4]);
    }

    /**
     * First matching shape wins: minutely, hourly, daily, weekly, monthly, yearly, otherwise custom
     */
    public CronFrequency inferFrequency(CronSchedule schedule) {
        CronFieldType minute = schedule.minuteType();
        CronFieldType hour = schedule.hourType();
        CronFieldType day = schedule.dayOfMonthType();
        CronFieldType month = schedule.monthType();
        CronFieldType weekday = schedule.dayOfWeekType();

        boolean dateFieldsOpen = day == CronFieldType.WILDCARD
                && month == CronFieldType.WILDCARD
                && weekday == CronFieldType.WILDCARD;

        if (hour == CronFieldType.WILDCARD && dateFieldsOpen) {
            return CronFrequency.MINUTELY;
        }
        if (hour != CronFieldType.FIXED && dateFieldsOpen) {
            return CronFrequency.HOURLY;
        }
        if (minute == CronFieldType.FIXED && hour == CronFieldType.FIXED && dateFieldsOpen) {
            return CronFrequency.DAILY;
        }
        if (weekday != CronFieldType.WILDCARD
                && day == CronFieldType.WILDCARD
                && month == CronFieldType.WILDCARD) {
            return CronFrequency.WEEKLY;
        }
        if (day == CronFieldType.FIXED
                && month == CronFieldType.WILDCARD
                && weekday == CronFieldType.WILDCARD) {
            return CronFrequency.MONTHLY;
        }
        if (day == CronFieldType.FIXED
                && month == CronFieldType.FIXED
                && weekday == CronFieldType.WILDCARD) {
            return CronFrequency.YEARLY;
        }
        return CronFrequency.CUSTOM;
    }
}
