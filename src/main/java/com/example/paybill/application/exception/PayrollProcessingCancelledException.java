package com.example.paybill.application.exception;

/**
 * Thrown when the calling thread is interrupted while a batch is waiting on its documents.
 */
public class PayrollProcessingCancelledException extends ApplicationException {

    public PayrollProcessingCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
