package com.flagship.lease_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of {@link AllocationEngine#propose}. Nothing is applied to any invoice; committing the
 * allocations to the receipt is the caller's decision.
 */
@Value
public class AllocationProposal {
    AllocationMode mode;
    BigDecimal netAmount;
    List<Allocation> allocations;
    BigDecimal allocatedAmount;
    BigDecimal unallocatedAmount;
}
