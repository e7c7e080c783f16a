package com.flagship.lease_ledger.document.event;

import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.document.DocumentType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every approval status change, automatic submissions included.
 */
@Value
public class ApprovalStatusChangedEvent implements DocumentEvent {
    UUID eventId;
    DocumentType documentType;
    UUID documentId;
    ApprovalStatus previousStatus;
    ApprovalStatus newStatus;
    String actor;
    String comment;
    String rejectionReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ApprovalStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ApprovalStatusChangedEvent of(DocumentRef document, ApprovalStatus previousStatus,
                                                ApprovalRecord current, String actor) {
        return new ApprovalStatusChangedEvent(
            UUID.randomUUID(),
            document.getType(),
            document.getId(),
            previousStatus,
            current.getStatus(),
            actor,
            current.getComment(),
            current.getRejectionReason(),
            Instant.now()
        );
    }
}
