package com.flagship.lease_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * The allocations proposed for a receipt add up to more than its net amount.
 */
@Getter
public class OverAllocationException extends ValidationException {

    private final BigDecimal netAmount;
    private final BigDecimal requestedTotal;

    public OverAllocationException(BigDecimal netAmount, BigDecimal requestedTotal) {
        super(String.format("Allocations total %s exceeds the receipt net amount %s",
                requestedTotal.toPlainString(), netAmount.toPlainString()));
        this.netAmount = netAmount;
        this.requestedTotal = requestedTotal;
    }
}
