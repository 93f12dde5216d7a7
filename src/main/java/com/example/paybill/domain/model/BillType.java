package com.example.paybill.domain.model;

/**
 * Kind of paybill document. Earning-side bills carry pay and allowances up to the gross amount,
 * deduction-side bills carry recoveries, total deductions and net pay.
 */
public enum BillType {
    EARNING,
    DEDUCTION
}
