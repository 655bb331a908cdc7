package com.derivsim.core.engine;

import com.derivsim.core.domain.PositionSide;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Locale;

public record MarginCall(
        String userId,
        PositionSide side,
        BigDecimal size,
        BigDecimal margin,
        BigDecimal maintenanceMargin,
        BigDecimal marginRatio,
        Level level
) {

    public enum Level {
        WARNING,
        URGENT,
        CRITICAL;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
