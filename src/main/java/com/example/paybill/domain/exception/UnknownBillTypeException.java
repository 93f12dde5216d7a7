package com.example.paybill.domain.exception;

/**
 * Raised when a document carries neither the earning-side nor the deduction-side marker.
 * The document is excluded from its batch; the rest of the batch proceeds.
 */
public class UnknownBillTypeException extends DomainException {

    public UnknownBillTypeException() {
        super("Cannot detect bill type: neither \"Earning Side\" nor \"Deduction Side\" found.");
    }
}
