package com.flagship.lease_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.contract.Contract;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ContractResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contract_no")
    String contractNo;

    @JsonProperty("customer_ref")
    String customerRef;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("remarks")
    String remarks;

    @JsonProperty("line_items")
    List<LineItemResponse> lineItems;

    @JsonProperty("units_total")
    BigDecimal unitsTotal;

    @JsonProperty("charges_total")
    BigDecimal chargesTotal;

    @JsonProperty("grand_total")
    BigDecimal grandTotal;

    @JsonProperty("approval_status")
    ApprovalStatus approvalStatus;

    @JsonProperty("approval_comment")
    String approvalComment;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("approval_decided_by")
    String approvalDecidedBy;

    @JsonProperty("version")
    Long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ContractResponse from(Contract contract) {
        return ContractResponse.builder()
            .id(contract.getId())
            .contractNo(contract.getContractNo())
            .customerRef(contract.getCustomerRef())
            .transactionDate(contract.getTransactionDate())
            .remarks(contract.getRemarks())
            .lineItems(contract.getLineItems().stream().map(LineItemResponse::from).toList())
            .unitsTotal(contract.getUnitsTotal())
            .chargesTotal(contract.getChargesTotal())
            .grandTotal(contract.getGrandTotal())
            .approvalStatus(contract.getApproval().getStatus())
            .approvalComment(contract.getApproval().getComment())
            .rejectionReason(contract.getApproval().getRejectionReason())
            .approvalDecidedBy(contract.getApproval().getDecidedBy())
            .version(contract.getVersion())
            .createdAt(contract.getCreatedAt())
            .updatedAt(contract.getUpdatedAt())
            .build();
    }
}
