package com.flagship.lease_ledger.calculation;

public enum LineItemKind {
    /**
     * A unit rented for a date range; base amount is the monthly rent.
     */
    UNIT_TERM,

    /**
     * An additional flat charge; base amount is the charge amount.
     */
    CHARGE
}
