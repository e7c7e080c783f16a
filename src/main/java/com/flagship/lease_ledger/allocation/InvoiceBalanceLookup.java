package com.flagship.lease_ledger.allocation;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read-only view of invoice balances owned by the billing side.
 */
public interface InvoiceBalanceLookup {

    /**
     * @return the outstanding balance, or empty when the invoice is unknown
     */
    Optional<BigDecimal> getOutstandingBalance(String invoiceRef);
}
