package com.flagship.lease_ledger.outbox;

import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.document.event.DocumentEvent;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * A row of {@code outbox_events}. The row id is the document event's own id, so consumers
 * deduplicate on the same value whether they read the Kafka payload or the table.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // assigned by the table's sequence, orders events of one document
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    public static OutboxEventEntity pending(DocumentEvent event, String payload) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.id = event.getEventId();
        entity.aggregateType = event.getDocumentType().getAggregateName();
        entity.aggregateId = event.getDocumentId();
        entity.eventType = event.getEventType();
        entity.payload = payload;
        entity.createdAt = event.getOccurredAt() != null ? event.getOccurredAt() : Instant.now();
        return entity;
    }

    public DocumentType getDocumentType() {
        return DocumentType.fromAggregateName(aggregateType);
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, getDocumentType(), aggregateId, eventType, payload, createdAt,
                publishedAt, retryCount, lastError, sequenceNumber);
    }

    public void markPublished() {
        this.publishedAt = Instant.now();
        this.lastError = null;
    }

    public void markFailed(String errorMessage) {
        this.retryCount++;
        this.lastError = errorMessage;
    }
}
