package com.derivsim.core.exception;

/**
 * Base of every failure the exchange reports for a command.
 */
public class ExchangeException extends RuntimeException {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
