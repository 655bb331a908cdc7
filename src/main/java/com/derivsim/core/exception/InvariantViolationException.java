package com.derivsim.core.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised in strict mode when the ledger no longer balances after a command.
 */
@Getter
public class InvariantViolationException extends ExchangeException {

    private final List<String> violations;

    public InvariantViolationException(List<String> violations) {
        super("Invariant violated: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
