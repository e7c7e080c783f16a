package com.flagship.lease_ledger.document.event;

import com.flagship.lease_ledger.document.DocumentType;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events about contracts and receipts.
 *
 * Events are facts: they are written to the outbox in the same transaction as the change they
 * describe and are never rewritten afterwards.
 */
public interface DocumentEvent {

    /**
     * Unique identifier for this event instance, used by consumers for deduplication.
     */
    UUID getEventId();

    DocumentType getDocumentType();

    UUID getDocumentId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
