package com.flagship.lease_ledger.receipt;

/**
 * How the customer paid.
 */
public enum PaymentType {
    CASH(true),
    CHEQUE(true),
    BANK_TRANSFER(false),
    CREDIT_CARD(false),
    DEBIT_CARD(false),
    ONLINE(false),
    MOBILE_PAYMENT(false);

    private final boolean physicalDeposit;

    PaymentType(boolean physicalDeposit) {
        this.physicalDeposit = physicalDeposit;
    }

    /**
     * Cash and cheques go through a bank deposit before they clear; electronic payments clear
     * straight from RECEIVED.
     */
    public boolean requiresDeposit() {
        return physicalDeposit;
    }
}
