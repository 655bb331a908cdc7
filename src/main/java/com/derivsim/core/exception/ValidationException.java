package com.derivsim.core.exception;

/**
 * Command rejected before any state was touched.
 */
public class ValidationException extends ExchangeException {

    public ValidationException(String message) {
        super(message);
    }
}
