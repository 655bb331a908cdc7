package com.derivsim.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

public record EngineHistoryEntry(
        Event event,
        String enginePositionId,
        String userId,
        BigDecimal size,
        BigDecimal price,
        String detail,
        Instant timestamp
) {

    public enum Event {
        RECEIVED,
        STATUS_CHANGE,
        REDUCED,
        CLOSED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
