package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.allocation.Allocation;
import com.flagship.lease_ledger.allocation.AllocationMode;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.document.DocumentRef;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Receipt aggregate.
 *
 * Immutable: every lifecycle change in {@link ReceiptLifecycle} returns a new instance.
 * netAmount is always round2(receivedAmount + securityDeposit + penalty - discount) and the
 * allocations never add up to more than it.
 */
@Value
@Builder(toBuilder = true)
public class Receipt {
    UUID id;
    String receiptNo;
    String customerRef;
    LocalDate receiptDate;
    PaymentType paymentType;
    String chequeNo;
    String depositBankRef;
    LocalDate depositDate;
    LocalDate clearanceDate;
    String notes;

    BigDecimal receivedAmount;
    BigDecimal securityDeposit;
    BigDecimal penalty;
    BigDecimal discount;
    BigDecimal netAmount;

    AllocationMode allocationMode;
    List<Allocation> allocations;
    BigDecimal unallocatedAmount;

    PaymentStatus paymentStatus;
    ApprovalRecord approval;
    boolean posted;
    String postedVoucherNo;

    Instant createdAt;
    Instant updatedAt;
    Long version;

    public DocumentRef ref() {
        return DocumentRef.receipt(id);
    }
}
