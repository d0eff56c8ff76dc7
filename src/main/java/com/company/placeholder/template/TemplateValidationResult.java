package com.company.placeholder.template;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TemplateValidationResult {
    boolean valid;

    @Singular
    List<String> issues;

    @Singular
    List<String> warnings;

    // Distinct {{...}} names in order of first appearance
    @Singular
    List<String> placeholders;

    @Singular
    List<String> requiredTimeParams;
}
