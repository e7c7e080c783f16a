package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.allocation.AllocationMode;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.receipt.PaymentStatus;
import com.flagship.lease_ledger.receipt.PaymentType;
import com.flagship.lease_ledger.receipt.Receipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ReceiptResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("receipt_no")
    String receiptNo;

    @JsonProperty("customer_ref")
    String customerRef;

    @JsonProperty("receipt_date")
    LocalDate receiptDate;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("cheque_no")
    String chequeNo;

    @JsonProperty("deposit_bank_ref")
    String depositBankRef;

    @JsonProperty("deposit_date")
    LocalDate depositDate;

    @JsonProperty("clearance_date")
    LocalDate clearanceDate;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("received_amount")
    BigDecimal receivedAmount;

    @JsonProperty("security_deposit")
    BigDecimal securityDeposit;

    @JsonProperty("penalty")
    BigDecimal penalty;

    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("allocation_mode")
    AllocationMode allocationMode;

    @JsonProperty("allocations")
    List<AllocationEntry> allocations;

    @JsonProperty("unallocated_amount")
    BigDecimal unallocatedAmount;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("approval_status")
    ApprovalStatus approvalStatus;

    @JsonProperty("approval_comment")
    String approvalComment;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("approval_decided_by")
    String approvalDecidedBy;

    @JsonProperty("is_posted")
    boolean posted;

    @JsonProperty("posted_voucher_no")
    String postedVoucherNo;

    @JsonProperty("version")
    Long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ReceiptResponse from(Receipt receipt) {
        return ReceiptResponse.builder()
            .id(receipt.getId())
            .receiptNo(receipt.getReceiptNo())
            .customerRef(receipt.getCustomerRef())
            .receiptDate(receipt.getReceiptDate())
            .paymentType(receipt.getPaymentType())
            .chequeNo(receipt.getChequeNo())
            .depositBankRef(receipt.getDepositBankRef())
            .depositDate(receipt.getDepositDate())
            .clearanceDate(receipt.getClearanceDate())
            .notes(receipt.getNotes())
            .receivedAmount(receipt.getReceivedAmount())
            .securityDeposit(receipt.getSecurityDeposit())
            .penalty(receipt.getPenalty())
            .discount(receipt.getDiscount())
            .netAmount(receipt.getNetAmount())
            .allocationMode(receipt.getAllocationMode())
            .allocations(receipt.getAllocations() == null ? List.of()
                : receipt.getAllocations().stream().map(AllocationEntry::from).toList())
            .unallocatedAmount(receipt.getUnallocatedAmount())
            .paymentStatus(receipt.getPaymentStatus())
            .approvalStatus(receipt.getApproval().getStatus())
            .approvalComment(receipt.getApproval().getComment())
            .rejectionReason(receipt.getApproval().getRejectionReason())
            .approvalDecidedBy(receipt.getApproval().getDecidedBy())
            .posted(receipt.isPosted())
            .postedVoucherNo(receipt.getPostedVoucherNo())
            .version(receipt.getVersion())
            .createdAt(receipt.getCreatedAt())
            .updatedAt(receipt.getUpdatedAt())
            .build();
    }
}
