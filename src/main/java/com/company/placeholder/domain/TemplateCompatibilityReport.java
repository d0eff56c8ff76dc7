package com.company.placeholder.domain;

import com.company.placeholder.template.TemplateValidationResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Whether a set of SQL templates can run under a task's schedule.
 */
@Value
@Builder
public class TemplateCompatibilityReport {
    boolean overallValid;

    @Singular
    Map<String, TemplateValidationResult> placeholderValidations;

    // Absent when the schedule could not be interpreted
    TimeInferenceResult timeInference;
    String timeInferenceError;

    boolean timePlaceholdersPresent;
    boolean cronExpressionProvided;

    @Singular
    List<String> recommendations;
}
