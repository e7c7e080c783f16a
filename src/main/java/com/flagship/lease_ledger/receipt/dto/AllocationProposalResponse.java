package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.allocation.AllocationMode;
import com.flagship.lease_ledger.allocation.AllocationProposal;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class AllocationProposalResponse {

    @JsonProperty("mode")
    AllocationMode mode;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("allocations")
    List<AllocationEntry> allocations;

    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @JsonProperty("unallocated_amount")
    BigDecimal unallocatedAmount;

    public static AllocationProposalResponse from(AllocationProposal proposal) {
        return new AllocationProposalResponse(
            proposal.getMode(),
            proposal.getNetAmount(),
            proposal.getAllocations().stream().map(AllocationEntry::from).toList(),
            proposal.getAllocatedAmount(),
            proposal.getUnallocatedAmount()
        );
    }
}
