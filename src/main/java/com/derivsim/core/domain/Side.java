package com.derivsim.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Side {
    BUY,
    SELL;

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** The position direction a fill on this side builds. */
    public PositionSide toPositionSide() {
        return this == BUY ? PositionSide.LONG : PositionSide.SHORT;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Side from(String value) {
        if (value == null) {
            return null;
        }
        return Side.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
