package com.flagship.lease_ledger.allocation;

/**
 * How a receipt's net amount is distributed over invoices.
 */
public enum AllocationMode {
    /**
     * One invoice; the engine allocates min(net amount, outstanding balance).
     */
    SINGLE,

    /**
     * Caller supplies every (invoice, amount) pair.
     */
    MULTIPLE,

    /**
     * The engine spreads the net amount over the given invoices in proportion to their
     * outstanding balances.
     */
    PROPORTIONAL
}
