package com.flagship.lease_ledger.ledger;

/**
 * Side of a posting line. Every voucher carries balanced debits and credits.
 */
public enum EntryType {
    DEBIT,
    CREDIT;

    /**
     * The side a reversal line is written on.
     */
    public EntryType opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
