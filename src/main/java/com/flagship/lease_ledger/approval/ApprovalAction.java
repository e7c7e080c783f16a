package com.flagship.lease_ledger.approval;

/**
 * Approval decisions that need a capability.
 */
public enum ApprovalAction {
    APPROVE,
    REJECT,
    RESET
}
