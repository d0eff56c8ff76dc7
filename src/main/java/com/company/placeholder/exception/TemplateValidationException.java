package com.company.placeholder.exception;

import java.util.List;

public class TemplateValidationException extends RuntimeException {

    private final List<String> issues;

    public TemplateValidationException(List<String> issues) {
        super("SQL template validation failed: " + issues);
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
