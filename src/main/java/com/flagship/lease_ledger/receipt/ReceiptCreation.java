package com.flagship.lease_ledger.receipt;

import lombok.Value;

/**
 * Result of an idempotent create: created is false when the key had been used before and the
 * earlier receipt is returned instead.
 */
@Value
public class ReceiptCreation {
    Receipt receipt;
    boolean created;
}
