package com.flagship.lease_ledger.receipt;

import lombok.Value;

import java.time.LocalDate;

/**
 * Auxiliary data some payment status changes need: bank and date for a deposit, date for a
 * clearance.
 */
@Value
public class PaymentStatusChange {
    PaymentStatus targetStatus;
    String depositBankRef;
    LocalDate depositDate;
    LocalDate clearanceDate;
    String note;

    public static PaymentStatusChange to(PaymentStatus targetStatus) {
        return new PaymentStatusChange(targetStatus, null, null, null, null);
    }
}
