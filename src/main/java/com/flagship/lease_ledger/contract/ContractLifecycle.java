package com.flagship.lease_ledger.contract;

import com.flagship.lease_ledger.approval.ApprovalGate;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.calculation.FieldRecalculator;
import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.calculation.LineItemField;
import com.flagship.lease_ledger.calculation.MoneyRounding;
import com.flagship.lease_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Contract draft rules: line item edits through {@link FieldRecalculator}, totals, and the
 * approval lock.
 *
 * Every change that moves the grand total goes through {@link ApprovalGate#onAmountChanged}, so
 * a contract that grows past the approval threshold is submitted automatically.
 */
@Component
@RequiredArgsConstructor
public class ContractLifecycle {

    private final FieldRecalculator fieldRecalculator;
    private final ApprovalGate approvalGate;

    public Contract create(UUID id, ContractDetails details, List<LineItem> rawLineItems) {
        validate(details);
        List<LineItem> items = new ArrayList<>();
        if (rawLineItems != null) {
            rawLineItems.forEach(raw -> items.add(fieldRecalculator.recalculateAll(withId(raw))));
        }

        Instant now = Instant.now();
        Contract draft = applyDetails(Contract.builder(), details)
            .id(id)
            .lineItems(List.copyOf(items))
            .createdAt(now)
            .updatedAt(now)
            .build();
        Contract totalled = withTotals(draft);
        return totalled.toBuilder().approval(approvalGate.initial(totalled.getGrandTotal())).build();
    }

    public Contract updateDetails(Contract contract, ContractDetails details) {
        approvalGate.requireMutable(contract.ref(), contract.getApproval(), "edit");
        validate(details);
        return applyDetails(contract.toBuilder(), details).updatedAt(Instant.now()).build();
    }

    public Contract addLineItem(Contract contract, LineItem rawLineItem) {
        approvalGate.requireMutable(contract.ref(), contract.getApproval(), "add line item");
        LineItem item = fieldRecalculator.recalculateAll(withId(rawLineItem));
        List<LineItem> items = new ArrayList<>(contract.getLineItems());
        items.add(item);
        return changeLineItems(contract, items);
    }

    public Contract removeLineItem(Contract contract, UUID lineItemId) {
        approvalGate.requireMutable(contract.ref(), contract.getApproval(), "remove line item");
        LineItem existing = requireLineItem(contract, lineItemId);
        List<LineItem> items = new ArrayList<>(contract.getLineItems());
        items.remove(existing);
        return changeLineItems(contract, items);
    }

    /**
     * Applies one field edit to one line item and refreshes the contract totals.
     */
    public Contract recalculateLineItem(Contract contract, UUID lineItemId, LineItemField field, Object newValue) {
        approvalGate.requireMutable(contract.ref(), contract.getApproval(), "edit line item");
        LineItem existing = requireLineItem(contract, lineItemId);
        LineItem updated = fieldRecalculator.recalculate(existing, field, newValue);

        List<LineItem> items = new ArrayList<>(contract.getLineItems());
        items.set(items.indexOf(existing), updated);
        return changeLineItems(contract, items);
    }

    public void checkCanDelete(Contract contract) {
        approvalGate.requireMutable(contract.ref(), contract.getApproval(), "delete");
    }

    public Contract withApproval(Contract contract, ApprovalRecord approval) {
        return contract.toBuilder().approval(approval).updatedAt(Instant.now()).build();
    }

    public LineItem requireLineItem(Contract contract, UUID lineItemId) {
        return contract.findLineItem(lineItemId)
            .orElseThrow(() -> new ValidationException(
                String.format("Line item %s not found on %s", lineItemId, contract.ref())));
    }

    private Contract changeLineItems(Contract contract, List<LineItem> items) {
        Contract totalled = withTotals(contract.toBuilder().lineItems(List.copyOf(items)).build());
        return totalled.toBuilder()
            .approval(approvalGate.onAmountChanged(contract.ref(), contract.getApproval(), totalled.getGrandTotal()))
            .updatedAt(Instant.now())
            .build();
    }

    static Contract withTotals(Contract contract) {
        BigDecimal units = MoneyRounding.sum(contract.getLineItems().stream()
            .filter(LineItem::isUnitTerm).map(LineItem::getTotalAmount).toList());
        BigDecimal charges = MoneyRounding.sum(contract.getLineItems().stream()
            .filter(item -> !item.isUnitTerm()).map(LineItem::getTotalAmount).toList());
        return contract.toBuilder()
            .unitsTotal(units)
            .chargesTotal(charges)
            .grandTotal(MoneyRounding.round2(units.add(charges)))
            .build();
    }

    private static LineItem withId(LineItem raw) {
        if (raw.getKind() == null) {
            throw new ValidationException("Line item kind is required");
        }
        if (raw.getItemRef() == null || raw.getItemRef().isBlank()) {
            throw new ValidationException("Line item reference is required");
        }
        return raw.getId() != null ? raw : raw.toBuilder().id(UUID.randomUUID()).build();
    }

    private static Contract.ContractBuilder applyDetails(Contract.ContractBuilder builder, ContractDetails details) {
        return builder
            .contractNo(details.getContractNo().trim())
            .customerRef(details.getCustomerRef())
            .transactionDate(details.getTransactionDate())
            .remarks(details.getRemarks());
    }

    private static void validate(ContractDetails details) {
        if (details == null) {
            throw new ValidationException("Contract details are required");
        }
        if (details.getContractNo() == null || details.getContractNo().isBlank()) {
            throw new ValidationException("Contract number is required");
        }
        if (details.getTransactionDate() == null) {
            throw new ValidationException("Transaction date is required");
        }
    }
}
