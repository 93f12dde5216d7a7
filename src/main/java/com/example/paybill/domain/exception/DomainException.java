package com.example.paybill.domain.exception;

/**
 * Base type for paybill domain failures: bad input documents and rows that break the bill layout rules.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation of which rule broke
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * @param message explanation of which rule broke
	 * @param cause   original exception that triggered the failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
