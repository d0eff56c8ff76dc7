package com.company.placeholder.exception;

import java.util.List;

public class MissingTemplateParameterException extends RuntimeException {

    private final List<String> missingKeys;

    public MissingTemplateParameterException(List<String> missingKeys) {
        super("Template parameters not supplied: " + missingKeys);
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
