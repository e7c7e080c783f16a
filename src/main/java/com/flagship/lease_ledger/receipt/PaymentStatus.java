package com.flagship.lease_ledger.receipt;

/**
 * Where the money of a receipt is.
 *
 * Transitions are enforced by {@link ReceiptLifecycle#changePaymentStatus}.
 */
public enum PaymentStatus {
    /**
     * Promised but not yet in hand.
     */
    PENDING,

    /**
     * In hand. Default status of a new receipt.
     */
    RECEIVED,

    /**
     * Cash or cheque taken to the bank. Needs a bank and a deposit date.
     */
    DEPOSITED,

    /**
     * Funds confirmed by the bank.
     */
    CLEARED,

    /**
     * Cheque or card payment returned unpaid. Can be corrected back to RECEIVED.
     */
    BOUNCED,

    /**
     * Voided. Can be corrected back to RECEIVED.
     */
    CANCELLED
}
