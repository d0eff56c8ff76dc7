package com.company.placeholder.domain.enums;

public enum PlaceholderState {
    PENDING("Waiting to be classified"),
    PERIOD_COMPUTED("Value derived from the task time"),
    CACHE_HIT("Value served from the latest cache version"),
    QUERY_RUNNING("Filled SQL is executing"),
    DONE("Value resolved"),
    FAILED("Value could not be resolved");

    private final String description;

    PlaceholderState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
