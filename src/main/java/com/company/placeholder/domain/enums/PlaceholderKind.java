package com.company.placeholder.domain.enums;

public enum PlaceholderKind {
    PERIOD,
    SQL;

    /**
     * Names carrying the period marker never need a data source
     */
    public static PlaceholderKind fromDisplayName(String displayName) {
        if (displayName != null && displayName.contains("周期")) {
            return PERIOD;
        }
        return SQL;
    }
}
