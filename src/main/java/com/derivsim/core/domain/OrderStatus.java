package com.derivsim.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OrderStatus {
    NEW,                // resting, nothing filled yet
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,           // user cancel, self-trade prevention, liquidation or unfilled market order
    REJECTED;           // failed pre-trade validation

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
