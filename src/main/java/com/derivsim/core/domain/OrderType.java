package com.derivsim.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OrderType {
    LIMIT,           // rests at its price when not fully filled
    MARKET;          // takes liquidity, remainder discarded

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OrderType from(String value) {
        if (value == null) {
            return null;
        }
        return OrderType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
