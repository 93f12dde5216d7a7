package com.example.paybill.domain.exception;

/**
 * Raised when a referenced paybill path does not exist on disk.
 */
public class PdfNotFoundException extends DomainException {

	/**
	 * @param path absolute or relative path that could not be resolved
	 */
    public PdfNotFoundException(String path) {
        super("Paybill PDF not found: " + path);
    }
}
