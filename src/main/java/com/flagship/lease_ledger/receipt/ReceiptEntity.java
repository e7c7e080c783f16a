package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.allocation.AllocationMode;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for receipts.
 *
 * No setters: state only changes through {@link #updateFromDomain}, which copies a receipt that
 * has already passed {@link ReceiptLifecycle}. The version column makes a stale write fail
 * instead of silently overwriting a concurrent change.
 *
 * The idempotency key is a persistence concern and is passed separately on creation.
 */
@Entity
@Table(
    name = "receipts",
    indexes = {
        @Index(name = "idx_receipts_idempotency_key", columnList = "idempotency_key"),
        @Index(name = "idx_receipts_payment_status", columnList = "payment_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReceiptEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "receipt_no", nullable = false, length = 64)
    private String receiptNo;

    @Column(name = "customer_ref", length = 64)
    private String customerRef;

    @Column(name = "receipt_date", nullable = false)
    private LocalDate receiptDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, length = 32)
    private PaymentType paymentType;

    @Column(name = "cheque_no", length = 64)
    private String chequeNo;

    @Column(name = "deposit_bank_ref", length = 64)
    private String depositBankRef;

    @Column(name = "deposit_date")
    private LocalDate depositDate;

    @Column(name = "clearance_date")
    private LocalDate clearanceDate;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "received_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal receivedAmount;

    @Column(name = "security_deposit", nullable = false, precision = 19, scale = 2)
    private BigDecimal securityDeposit;

    @Column(name = "penalty", nullable = false, precision = 19, scale = 2)
    private BigDecimal penalty;

    @Column(name = "discount", nullable = false, precision = 19, scale = 2)
    private BigDecimal discount;

    @Column(name = "net_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "allocation_mode", length = 16)
    private AllocationMode allocationMode;

    @ElementCollection
    @CollectionTable(name = "receipt_allocations", joinColumns = @JoinColumn(name = "receipt_id"))
    @OrderColumn(name = "line_no")
    private List<AllocationEmbeddable> allocations = new ArrayList<>();

    @Column(name = "unallocated_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal unallocatedAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 16)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false, length = 16)
    private ApprovalStatus approvalStatus;

    @Column(name = "approval_comment", columnDefinition = "TEXT")
    private String approvalComment;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "approval_decided_by", length = 128)
    private String approvalDecidedBy;

    @Column(name = "approval_decided_at")
    private Instant approvalDecidedAt;

    @Column(name = "is_posted", nullable = false)
    private boolean posted;

    @Column(name = "posted_voucher_no", length = 64)
    private String postedVoucherNo;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ReceiptEntity fromDomain(Receipt receipt, String idempotencyKey) {
        ReceiptEntity entity = new ReceiptEntity();
        entity.id = receipt.getId();
        entity.idempotencyKey = idempotencyKey;
        entity.updateFromDomain(receipt);
        return entity;
    }

    public Receipt toDomain() {
        return Receipt.builder()
            .id(id)
            .receiptNo(receiptNo)
            .customerRef(customerRef)
            .receiptDate(receiptDate)
            .paymentType(paymentType)
            .chequeNo(chequeNo)
            .depositBankRef(depositBankRef)
            .depositDate(depositDate)
            .clearanceDate(clearanceDate)
            .notes(notes)
            .receivedAmount(receivedAmount)
            .securityDeposit(securityDeposit)
            .penalty(penalty)
            .discount(discount)
            .netAmount(netAmount)
            .allocationMode(allocationMode)
            .allocations(allocations.stream().map(AllocationEmbeddable::toDomain).toList())
            .unallocatedAmount(unallocatedAmount)
            .paymentStatus(paymentStatus)
            .approval(new ApprovalRecord(approvalStatus, approvalComment, rejectionReason,
                approvalDecidedBy, approvalDecidedAt))
            .posted(posted)
            .postedVoucherNo(postedVoucherNo)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .version(version)
            .build();
    }

    /**
     * Copies every mutable field. id, idempotency key, created_at and version are never copied.
     */
    void updateFromDomain(Receipt receipt) {
        this.receiptNo = receipt.getReceiptNo();
        this.customerRef = receipt.getCustomerRef();
        this.receiptDate = receipt.getReceiptDate();
        this.paymentType = receipt.getPaymentType();
        this.chequeNo = receipt.getChequeNo();
        this.depositBankRef = receipt.getDepositBankRef();
        this.depositDate = receipt.getDepositDate();
        this.clearanceDate = receipt.getClearanceDate();
        this.notes = receipt.getNotes();
        this.receivedAmount = receipt.getReceivedAmount();
        this.securityDeposit = receipt.getSecurityDeposit();
        this.penalty = receipt.getPenalty();
        this.discount = receipt.getDiscount();
        this.netAmount = receipt.getNetAmount();
        this.allocationMode = receipt.getAllocationMode();
        this.allocations.clear();
        if (receipt.getAllocations() != null) {
            receipt.getAllocations().forEach(a -> this.allocations.add(AllocationEmbeddable.fromDomain(a)));
        }
        this.unallocatedAmount = receipt.getUnallocatedAmount();
        this.paymentStatus = receipt.getPaymentStatus();
        ApprovalRecord approval = receipt.getApproval();
        this.approvalStatus = approval.getStatus();
        this.approvalComment = approval.getComment();
        this.rejectionReason = approval.getRejectionReason();
        this.approvalDecidedBy = approval.getDecidedBy();
        this.approvalDecidedAt = approval.getDecidedAt();
        this.posted = receipt.isPosted();
        this.postedVoucherNo = receipt.getPostedVoucherNo();
    }
}
