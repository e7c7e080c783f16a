package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.allocation.Allocation;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class AllocationEntry {

    @JsonProperty("invoice_ref")
    String invoiceRef;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("notes")
    String notes;

    public Allocation toDomain() {
        return new Allocation(invoiceRef, amount, notes);
    }

    public static AllocationEntry from(Allocation allocation) {
        return new AllocationEntry(allocation.getInvoiceRef(), allocation.getAmount(), allocation.getNotes());
    }
}
