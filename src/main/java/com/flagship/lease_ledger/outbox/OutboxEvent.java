package com.flagship.lease_ledger.outbox;

import com.flagship.lease_ledger.document.DocumentType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A document event waiting in, or already relayed from, the outbox table.
 */
@Value
public class OutboxEvent {
    UUID id;                   // the document event's id
    DocumentType documentType;
    UUID aggregateId;          // document id
    String eventType;          // e.g. "DocumentPosted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
