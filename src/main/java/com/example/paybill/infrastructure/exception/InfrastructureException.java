package com.example.paybill.infrastructure.exception;

/**
 * Base unchecked exception for infrastructure concerns (PDF decoding, file IO).
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
