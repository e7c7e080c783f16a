package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.allocation.Allocation;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A row of {@code receipt_allocations}.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AllocationEmbeddable {

    @Column(name = "invoice_ref", nullable = false, length = 64)
    private String invoiceRef;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "notes")
    private String notes;

    static AllocationEmbeddable fromDomain(Allocation allocation) {
        return new AllocationEmbeddable(allocation.getInvoiceRef(), allocation.getAmount(), allocation.getNotes());
    }

    Allocation toDomain() {
        return new Allocation(invoiceRef, amount, notes);
    }
}
