package com.derivsim.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

public record InsuranceFundEntry(
        Type type,
        BigDecimal amount,          // signed movement
        BigDecimal balanceAfter,
        String description,
        Instant timestamp
) {

    public enum Type {
        INITIAL,
        LIQUIDATION_MARGIN,
        ADL_SETTLEMENT,
        BANKRUPT_CLOSE,
        MANUAL_ADJUSTMENT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
