package com.derivsim.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Locale;

public enum PositionSide {
    LONG,
    SHORT;

    public PositionSide opposite() {
        return this == LONG ? SHORT : LONG;
    }

    /** +1 for long, -1 for short. */
    public BigDecimal sign() {
        return this == LONG ? BigDecimal.ONE : BigDecimal.ONE.negate();
    }

    /** Order side that adds to a position of this direction. */
    public Side openingSide() {
        return this == LONG ? Side.BUY : Side.SELL;
    }

    /** Order side that reduces a position of this direction. */
    public Side closingSide() {
        return this == LONG ? Side.SELL : Side.BUY;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PositionSide from(String value) {
        if (value == null) {
            return null;
        }
        return PositionSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
