package com.flagship.lease_ledger.approval;

import lombok.Value;

import java.time.Instant;

/**
 * Approval status plus the last decision taken on it.
 */
@Value
public class ApprovalRecord {
    ApprovalStatus status;
    String comment;
    String rejectionReason;
    String decidedBy;
    Instant decidedAt;

    public static ApprovalRecord of(ApprovalStatus status) {
        return new ApprovalRecord(status, null, null, null, null);
    }

    public boolean isApproved() {
        return status == ApprovalStatus.APPROVED;
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    /**
     * Posting is allowed once approved, or when no approval was ever needed.
     */
    public boolean allowsPosting() {
        return status == ApprovalStatus.APPROVED || status == ApprovalStatus.NOT_REQUIRED;
    }
}
