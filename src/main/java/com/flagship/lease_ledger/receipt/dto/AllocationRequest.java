package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.allocation.Allocation;
import com.flagship.lease_ledger.allocation.AllocationMode;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class AllocationRequest {

    @NotNull(message = "Allocation mode is required")
    @JsonProperty("mode")
    AllocationMode mode;

    @JsonProperty("entries")
    List<AllocationEntry> entries;

    public List<Allocation> toDomain() {
        return entries == null ? List.of() : entries.stream().map(AllocationEntry::toDomain).toList();
    }
}
