package com.derivsim.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EnginePositionStatus {
    PENDING,
    PROCESSING,
    COMPLETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
