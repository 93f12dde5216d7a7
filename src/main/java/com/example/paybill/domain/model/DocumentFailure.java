package com.example.paybill.domain.model;

/**
 * A document excluded from the batch, with the reason it could not be parsed.
 */
public record DocumentFailure(
        String fileName,
        String reason
) {
}
