package com.flagship.lease_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.contract.ContractDetails;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class ContractRequest {

    @NotBlank(message = "Contract number is required")
    @JsonProperty("contract_no")
    String contractNo;

    @JsonProperty("customer_ref")
    String customerRef;

    @NotNull(message = "Transaction date is required")
    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("remarks")
    String remarks;

    /**
     * Optional on create, ignored on header updates.
     */
    @Valid
    @JsonProperty("line_items")
    List<LineItemRequest> lineItems;

    public ContractDetails toDetails() {
        return ContractDetails.builder()
            .contractNo(contractNo)
            .customerRef(customerRef)
            .transactionDate(transactionDate)
            .remarks(remarks)
            .build();
    }

    public List<LineItem> toLineItems() {
        return lineItems == null ? List.of() : lineItems.stream().map(LineItemRequest::toDomain).toList();
    }
}
