package com.company.placeholder.domain;

import com.company.placeholder.domain.enums.CronFrequency;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class TimeInferenceResult {
    LocalDate baseDate;
    CronFrequency frequency;
    int dataLagDays;
    double confidence;
    String explanation;

    String cronExpression;
    boolean testMode;
}
