package com.flagship.lease_ledger.receipt.event;

import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.document.event.DocumentEvent;
import com.flagship.lease_ledger.receipt.PaymentStatus;
import com.flagship.lease_ledger.receipt.PaymentType;
import com.flagship.lease_ledger.receipt.Receipt;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class ReceiptCreatedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    String receiptNo;
    String customerRef;
    LocalDate receiptDate;
    PaymentType paymentType;
    BigDecimal netAmount;
    PaymentStatus paymentStatus;
    ApprovalStatus approvalStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ReceiptCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public DocumentType getDocumentType() {
        return DocumentType.RECEIPT;
    }

    public static ReceiptCreatedEvent fromReceipt(Receipt receipt) {
        return new ReceiptCreatedEvent(
            UUID.randomUUID(),
            receipt.getId(),
            receipt.getReceiptNo(),
            receipt.getCustomerRef(),
            receipt.getReceiptDate(),
            receipt.getPaymentType(),
            receipt.getNetAmount(),
            receipt.getPaymentStatus(),
            receipt.getApproval().getStatus(),
            Instant.now()
        );
    }
}
