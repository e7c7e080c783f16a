package com.flagship.lease_ledger.approval;

/**
 * Approval state of a contract or receipt.
 *
 * Transitions:
 * - NOT_REQUIRED, REJECTED -> PENDING (submit, explicit or automatic)
 * - PENDING -> APPROVED (approve) or REJECTED (reject)
 * - APPROVED, REJECTED -> PENDING (reset)
 */
public enum ApprovalStatus {
    /**
     * Amount is below the approval threshold and nobody asked for approval.
     */
    NOT_REQUIRED,

    /**
     * Waiting for an approver.
     */
    PENDING,

    /**
     * Locked. Only a reset unlocks the document.
     */
    APPROVED,

    REJECTED
}
