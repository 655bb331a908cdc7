package com.derivsim.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TradeType {
    NORMAL,
    ADL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
