package com.flagship.lease_ledger.contract;

import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.calculation.LineItem;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JPA entity for contracts. Line items are owned rows, kept in entry order.
 *
 * As with receipts, state only changes through {@link #updateFromDomain} and the version column
 * turns a stale write into a conflict.
 */
@Entity
@Table(name = "contracts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContractEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_no", nullable = false, length = 64)
    private String contractNo;

    @Column(name = "customer_ref", length = 64)
    private String customerRef;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(name = "remarks", columnDefinition = "TEXT")
    private String remarks;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "contract_id", nullable = false)
    @OrderColumn(name = "line_no")
    private List<LineItemEntity> lineItems = new ArrayList<>();

    @Column(name = "units_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal unitsTotal;

    @Column(name = "charges_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal chargesTotal;

    @Column(name = "grand_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal grandTotal;

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

    static ContractEntity fromDomain(Contract contract) {
        ContractEntity entity = new ContractEntity();
        entity.id = contract.getId();
        entity.updateFromDomain(contract);
        return entity;
    }

    public Contract toDomain() {
        return Contract.builder()
            .id(id)
            .contractNo(contractNo)
            .customerRef(customerRef)
            .transactionDate(transactionDate)
            .remarks(remarks)
            .lineItems(lineItems.stream().map(LineItemEntity::toDomain).toList())
            .unitsTotal(unitsTotal)
            .chargesTotal(chargesTotal)
            .grandTotal(grandTotal)
            .approval(new ApprovalRecord(approvalStatus, approvalComment, rejectionReason,
                approvalDecidedBy, approvalDecidedAt))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .version(version)
            .build();
    }

    /**
     * Copies every mutable field. Existing line item rows are updated in place by id, rows no
     * longer on the contract are removed and new ones appended.
     */
    void updateFromDomain(Contract contract) {
        this.contractNo = contract.getContractNo();
        this.customerRef = contract.getCustomerRef();
        this.transactionDate = contract.getTransactionDate();
        this.remarks = contract.getRemarks();

        Map<UUID, LineItemEntity> existing = lineItems.stream()
            .collect(Collectors.toMap(LineItemEntity::getId, Function.identity()));
        List<LineItemEntity> merged = new ArrayList<>();
        for (LineItem item : contract.getLineItems()) {
            LineItemEntity row = existing.get(item.getId());
            if (row == null) {
                row = LineItemEntity.fromDomain(item);
            } else {
                row.updateFromDomain(item);
            }
            merged.add(row);
        }
        this.lineItems.clear();
        this.lineItems.addAll(merged);

        this.unitsTotal = contract.getUnitsTotal();
        this.chargesTotal = contract.getChargesTotal();
        this.grandTotal = contract.getGrandTotal();
        ApprovalRecord approval = contract.getApproval();
        this.approvalStatus = approval.getStatus();
        this.approvalComment = approval.getComment();
        this.rejectionReason = approval.getRejectionReason();
        this.approvalDecidedBy = approval.getDecidedBy();
        this.approvalDecidedAt = approval.getDecidedAt();
    }
}
