package com.flagship.lease_ledger.receipt.event;

import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.document.event.DocumentEvent;
import com.flagship.lease_ledger.receipt.PaymentStatus;
import com.flagship.lease_ledger.receipt.Receipt;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class PaymentStatusChangedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    PaymentStatus previousStatus;
    PaymentStatus newStatus;
    String depositBankRef;
    LocalDate depositDate;
    LocalDate clearanceDate;
    String actor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public DocumentType getDocumentType() {
        return DocumentType.RECEIPT;
    }

    public static PaymentStatusChangedEvent of(PaymentStatus previousStatus, Receipt receipt, String actor) {
        return new PaymentStatusChangedEvent(
            UUID.randomUUID(),
            receipt.getId(),
            previousStatus,
            receipt.getPaymentStatus(),
            receipt.getDepositBankRef(),
            receipt.getDepositDate(),
            receipt.getClearanceDate(),
            actor,
            Instant.now()
        );
    }
}
