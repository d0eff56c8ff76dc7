package com.company.placeholder.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Inputs that address a cache version: what ran, with which parameters, and when.
 */
@Value
@Builder(toBuilder = true)
public class CacheWriteContext {
    LocalDateTime executionTime;
    String reportPeriod;
    String filledSql;
    ParameterSet sqlParameters;
}
