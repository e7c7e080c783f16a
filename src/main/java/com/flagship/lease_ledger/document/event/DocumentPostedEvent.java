package com.flagship.lease_ledger.document.event;

import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.ledger.PostingRequest;
import com.flagship.lease_ledger.ledger.PostingResult;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class DocumentPostedEvent implements DocumentEvent {
    UUID eventId;
    DocumentType documentType;
    UUID documentId;
    String voucherNo;
    LocalDate postingDate;
    String debitAccountRef;
    String creditAccountRef;
    BigDecimal amount;
    String actor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DocumentPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DocumentPostedEvent of(PostingResult result, PostingRequest request, String actor) {
        return new DocumentPostedEvent(
            UUID.randomUUID(),
            result.getDocument().getType(),
            result.getDocument().getId(),
            result.getVoucherNo(),
            request.getPostingDate(),
            request.getDebitAccountRef(),
            request.getCreditAccountRef(),
            request.getAmount(),
            actor,
            Instant.now()
        );
    }
}
