package com.flagship.lease_ledger.contract.event;

import com.flagship.lease_ledger.contract.Contract;
import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.document.event.DocumentEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a line item change moves the contract's grand total.
 */
@Value
public class ContractTotalsChangedEvent implements DocumentEvent {
    UUID eventId;
    UUID documentId;
    String change;
    BigDecimal previousGrandTotal;
    BigDecimal unitsTotal;
    BigDecimal chargesTotal;
    BigDecimal grandTotal;
    String actor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContractTotalsChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public DocumentType getDocumentType() {
        return DocumentType.CONTRACT;
    }

    public static ContractTotalsChangedEvent of(String change, BigDecimal previousGrandTotal, Contract contract, String actor) {
        return new ContractTotalsChangedEvent(
            UUID.randomUUID(),
            contract.getId(),
            change,
            previousGrandTotal,
            contract.getUnitsTotal(),
            contract.getChargesTotal(),
            contract.getGrandTotal(),
            actor,
            Instant.now()
        );
    }
}
