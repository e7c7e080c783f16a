package com.flagship.lease_ledger.document.event;

import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.ledger.ReversalResult;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PostingReversedEvent implements DocumentEvent {
    UUID eventId;
    DocumentType documentType;
    UUID documentId;
    String reversedVoucherNo;
    String reversalVoucherNo;
    String reason;
    String actor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PostingReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PostingReversedEvent of(ReversalResult result, String actor) {
        return new PostingReversedEvent(
            UUID.randomUUID(),
            result.getDocument().getType(),
            result.getDocument().getId(),
            result.getReversedVoucherNo(),
            result.getReversalVoucherNo(),
            result.getReason(),
            actor,
            Instant.now()
        );
    }
}
