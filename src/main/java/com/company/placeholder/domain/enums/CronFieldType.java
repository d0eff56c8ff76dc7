package com.company.placeholder.domain.enums;

public enum CronFieldType {
    WILDCARD,
    FIXED,
    LIST,
    RANGE,
    STEP;

    public static CronFieldType classify(String field) {
        if ("*".equals(field)) {
            return WILDCARD;
        }
        if (field.contains("/")) {
            return STEP;
        }
        if (field.contains(",")) {
            return LIST;
        }
        if (field.contains("-")) {
            return RANGE;
        }
        return FIXED;
    }
}
