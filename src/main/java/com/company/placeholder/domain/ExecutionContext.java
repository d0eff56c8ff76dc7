package com.company.placeholder.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One task run. Produces exactly one time inference and one parameter set.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionContext {
    String cronExpression;
    LocalDateTime nominalTime;

    boolean testMode;
    LocalDate fixedTestDate;

    @Builder.Default
    int testDaysOffset = -1;

    public static ExecutionContext scheduled(String cronExpression, LocalDateTime nominalTime) {
        return ExecutionContext.builder()
                .cronExpression(cronExpression)
                .nominalTime(nominalTime)
                .build();
    }

    public static ExecutionContext test(LocalDate fixedTestDate) {
        return ExecutionContext.builder()
                .testMode(true)
                .fixedTestDate(fixedTestDate)
                .build();
    }
}
