package com.example.paybill.application.exception;

/**
 * Signals that a use case could not produce any result from the input it was given.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
