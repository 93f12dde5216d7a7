package com.example.paybill.domain.model;

/**
 * Schema column label together with the canonical key and category it normalizes to.
 */
public record NormalizedHeader(
        String raw,
        String canonical,
        FieldCategory category
) {
}
