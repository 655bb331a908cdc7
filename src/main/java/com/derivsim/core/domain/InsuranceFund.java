package com.derivsim.core.domain;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Signed balance of the exchange's backstop. It is allowed to go negative.
 */
@Slf4j
public class InsuranceFund {

    /** Oldest entries are dropped past this size. */
    public static final int MAX_HISTORY = 1000;

    @Getter
    private BigDecimal balance;
    private final Deque<InsuranceFundEntry> history = new ArrayDeque<>();

    public InsuranceFund(BigDecimal initialBalance) {
        this.balance = BigDecimal.ZERO;
        apply(InsuranceFundEntry.Type.INITIAL, initialBalance, "initial funding");
    }

    public InsuranceFundEntry apply(InsuranceFundEntry.Type type, BigDecimal amount, String description) {
        balance = balance.add(amount);
        InsuranceFundEntry entry = new InsuranceFundEntry(type, amount, balance, description, Instant.now());
        history.addLast(entry);
        if (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
        if (balance.signum() < 0) {
            log.warn("Insurance fund negative after {} {}: {}", type, amount.toPlainString(), balance.toPlainString());
        }
        return entry;
    }

    public List<InsuranceFundEntry> getHistory() {
        return List.copyOf(history);
    }
}
