package com.example.paybill.domain.model;

/**
 * Category tag attached to each canonical field key.
 */
public enum FieldCategory {
    EARNING,
    DEDUCTION,
    UNKNOWN
}
