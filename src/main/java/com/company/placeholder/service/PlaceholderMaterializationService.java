package com.company.placeholder.service;

import com.company.placeholder.config.PlaceholderProperties;
import com.company.placeholder.domain.BatchResult;
import com.company.placeholder.domain.ExecutionContext;
import com.company.placeholder.domain.MaterializationResult;
import com.company.placeholder.domain.PlaceholderSpec;
import com.company.placeholder.domain.TemplateCompatibilityReport;
import com.company.placeholder.domain.TimeInferenceResult;
import com.company.placeholder.exception.InvalidCronException;
import com.company.placeholder.template.SqlTemplateFiller;
import com.company.placeholder.template.TemplateValidationResult;
import com.company.placeholder.time.TimeInferenceEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for a task run: derives the base date from the task's schedule and computes
 * its placeholders.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlaceholderMaterializationService {

    static final double LOW_CONFIDENCE_THRESHOLD = 0.7;

    private final TimeInferenceEngine timeInferenceEngine;
    private final SqlTemplateFiller templateFiller;
    private final BatchExecutor batchExecutor;
    private final PlaceholderProperties properties;

    /**
     * Test-mode runs bypass the cache in both directions.
     *
     * @param maxConcurrency null for the configured default
     * @throws InvalidCronException when no base date can be derived; no placeholder is computed then
     */
    public MaterializationResult materialize(List<PlaceholderSpec> placeholders, ExecutionContext context,
                                             Map<String, ?> additionalParams, Integer maxConcurrency) {
        TimeInferenceResult timeInference = timeInferenceEngine.resolve(context);

        log.info("Materializing {} placeholder(s) for base date {} ({}, confidence {})",
                placeholders.size(), timeInference.getBaseDate(),
                timeInference.getFrequency(), timeInference.getConfidence());

        BatchResult batchResult = batchExecutor.run(
                placeholders,
                timeInference.getBaseDate(),
                context.isTestMode() ? null : context,
                additionalParams != null ? additionalParams : Map.of(),
                maxConcurrency != null ? maxConcurrency : properties.getBatch().getMaxConcurrency());

        return MaterializationResult.builder()
                .timeInference(timeInference)
                .batchResult(batchResult)
                .build();
    }

    /**
     * Checks SQL templates against a task before it is scheduled. A schedule that cannot be
     * interpreted is reported, not raised, and does not make the templates invalid.
     */
    public TemplateCompatibilityReport validateTemplatesForTask(Map<String, String> sqlTemplates,
                                                                ExecutionContext context) {
        log.info("Validating {} template(s) for task", sqlTemplates.size());

        TemplateCompatibilityReport.TemplateCompatibilityReportBuilder report = TemplateCompatibilityReport.builder();
        boolean cronProvided = context != null
                && context.getCronExpression() != null
                && !context.getCronExpression().isBlank();
        report.cronExpressionProvided(cronProvided);

        if (context != null && (cronProvided || context.isTestMode())) {
            try {
                TimeInferenceResult timeInference = timeInferenceEngine.resolve(context);
                report.timeInference(timeInference);
                if (timeInference.getConfidence() < LOW_CONFIDENCE_THRESHOLD) {
                    report.recommendation(String.format(Locale.ROOT,
                            "Schedule inference confidence is low (%.2f); check the task frequency",
                            timeInference.getConfidence()));
                }
            } catch (InvalidCronException e) {
                log.warn("Task schedule cannot be interpreted: {}", e.getMessage());
                report.timeInferenceError(e.getMessage());
                report.recommendation("Time inference failed: " + e.getMessage());
            }
        } else {
            report.recommendation("No cron expression provided; time inference cannot be verified");
        }

        boolean overallValid = true;
        boolean timePlaceholders = false;
        for (Map.Entry<String, String> template : sqlTemplates.entrySet()) {
            TemplateValidationResult validation = templateFiller.validate(template.getValue());
            report.placeholderValidation(template.getKey(), validation);
            overallValid &= validation.isValid();
            timePlaceholders |= !validation.getRequiredTimeParams().isEmpty();
        }

        TemplateCompatibilityReport result = report
                .overallValid(overallValid)
                .timePlaceholdersPresent(timePlaceholders)
                .build();

        log.info("Template validation for task {}", overallValid ? "passed" : "failed");
        return result;
    }
}
