package com.flagship.lease_ledger.contract.event;

import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.contract.Contract;
import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.document.event.DocumentEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class ContractCreatedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    String contractNo;
    String customerRef;
    LocalDate transactionDate;
    int lineItemCount;
    BigDecimal grandTotal;
    ApprovalStatus approvalStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public DocumentType getDocumentType() {
        return DocumentType.CONTRACT;
    }

    public static ContractCreatedEvent fromContract(Contract contract) {
        return new ContractCreatedEvent(
            UUID.randomUUID(),
            contract.getId(),
            contract.getContractNo(),
            contract.getCustomerRef(),
            contract.getTransactionDate(),
            contract.getLineItems().size(),
            contract.getGrandTotal(),
            contract.getApproval().getStatus(),
            Instant.now()
        );
    }
}
