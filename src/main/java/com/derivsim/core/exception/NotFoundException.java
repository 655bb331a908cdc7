package com.derivsim.core.exception;

public class NotFoundException extends ExchangeException {

    public NotFoundException(String message) {
        super(message);
    }
}
