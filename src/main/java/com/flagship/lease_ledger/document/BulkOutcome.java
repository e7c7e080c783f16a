package com.flagship.lease_ledger.document;

/**
 * What happened to one document in a bulk operation.
 */
public enum BulkOutcome {
    APPLIED,
    SKIPPED
}
