package com.flagship.lease_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A share of a receipt's net amount applied to one invoice.
 * On requests the amount may be null (single and proportional modes compute it).
 */
@Value
public class Allocation {
    String invoiceRef;
    BigDecimal amount;
    String notes;

    public static Allocation of(String invoiceRef, BigDecimal amount) {
        return new Allocation(invoiceRef, amount, null);
    }

    public Allocation withAmount(BigDecimal newAmount) {
        return new Allocation(invoiceRef, newAmount, notes);
    }
}
