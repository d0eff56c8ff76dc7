package com.company.placeholder.domain.enums;

public enum ValueSource {
    PERIOD,
    CACHE,
    QUERY,
    ERROR
}
