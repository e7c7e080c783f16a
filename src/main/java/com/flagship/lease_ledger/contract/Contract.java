package com.flagship.lease_ledger.contract;

import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.document.DocumentRef;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract aggregate: header fields plus unit-term and charge line items.
 *
 * Totals are derived from the line items by {@link ContractLifecycle} whenever the items change:
 * unitsTotal sums unit-term totals, chargesTotal sums charge totals, and
 * grandTotal = round2(unitsTotal + chargesTotal).
 */
@Value
@Builder(toBuilder = true)
public class Contract {
    UUID id;
    String contractNo;
    String customerRef;
    LocalDate transactionDate;
    String remarks;

    List<LineItem> lineItems;

    BigDecimal unitsTotal;
    BigDecimal chargesTotal;
    BigDecimal grandTotal;

    ApprovalRecord approval;

    Instant createdAt;
    Instant updatedAt;
    Long version;

    public DocumentRef ref() {
        return DocumentRef.contract(id);
    }

    public Optional<LineItem> findLineItem(UUID lineItemId) {
        return lineItems.stream().filter(item -> item.getId().equals(lineItemId)).findFirst();
    }
}
