package com.flagship.lease_ledger.contract;

import com.flagship.lease_ledger.approval.ApprovalGate;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.approval.ConfiguredActorAuthorization;
import com.flagship.lease_ledger.calculation.FieldRecalculator;
import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.calculation.LineItemField;
import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import com.flagship.lease_ledger.exception.ProtectedDocumentException;
import com.flagship.lease_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ContractLifecycleTest {

    private static final Map<String, BigDecimal> TAX_RATES = Map.of(
        "VAT5", new BigDecimal("5.00"),
        "VAT15", new BigDecimal("15.00")
    );

    private ContractLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        LeaseLedgerProperties properties = new LeaseLedgerProperties();
        properties.getApproval().setThreshold(new BigDecimal("50000.00"));
        ApprovalGate gate = new ApprovalGate(properties, new ConfiguredActorAuthorization(properties));
        FieldRecalculator recalculator = new FieldRecalculator(id -> Optional.ofNullable(TAX_RATES.get(id)));
        lifecycle = new ContractLifecycle(recalculator, gate);
    }

    private static ContractDetails details() {
        return ContractDetails.builder()
            .contractNo(" LC-2024-001 ")
            .customerRef("CUST-9")
            .transactionDate(LocalDate.of(2024, 1, 1))
            .build();
    }

    private static LineItem unit(String monthlyRent) {
        return LineItem.unitTerm(null, "UNIT-101", new BigDecimal(monthlyRent), 12, "VAT5",
                LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1));
    }

    private Contract contract() {
        return lifecycle.create(UUID.randomUUID(), details(), List.of(
                unit("1000"),
                LineItem.charge(null, "MAINTENANCE", new BigDecimal("1000"), "VAT15")));
    }

    @Test
    @DisplayName("Creation recalculates every line and splits totals into units and charges")
    void createComputesTotals() {
        Contract contract = contract();

        assertEquals("LC-2024-001", contract.getContractNo());
        assertEquals(2, contract.getLineItems().size());
        assertTrue(contract.getLineItems().stream().allMatch(item -> item.getId() != null));
        assertEquals(new BigDecimal("12600.00"), contract.getUnitsTotal());
        assertEquals(new BigDecimal("1150.00"), contract.getChargesTotal());
        assertEquals(new BigDecimal("13750.00"), contract.getGrandTotal());
        assertEquals(ApprovalStatus.NOT_REQUIRED, contract.getApproval().getStatus());
    }

    @Test
    @DisplayName("A contract created above the threshold starts PENDING")
    void largeContractStartsPending() {
        Contract contract = lifecycle.create(UUID.randomUUID(), details(), List.of(unit("5000")));

        assertEquals(new BigDecimal("63000.00"), contract.getGrandTotal());
        assertEquals(ApprovalStatus.PENDING, contract.getApproval().getStatus());
    }

    @Test
    @DisplayName("Editing a line item refreshes the totals and auto-submits past the threshold")
    void recalculateLineItemAutoSubmits() {
        Contract contract = contract();
        UUID unitId = contract.getLineItems().get(0).getId();

        Contract updated = lifecycle.recalculateLineItem(contract, unitId, LineItemField.BASE_AMOUNT, "4000");

        assertEquals(new BigDecimal("50400.00"), updated.getUnitsTotal());
        assertEquals(new BigDecimal("51550.00"), updated.getGrandTotal());
        assertEquals(ApprovalStatus.PENDING, updated.getApproval().getStatus());
        assertEquals(new BigDecimal("1000.00"), contract.getLineItems().get(0).getBaseAmount().setScale(2));
    }

    @Test
    @DisplayName("Adding and removing line items keeps the totals in step")
    void addAndRemoveLineItems() {
        Contract contract = contract();

        Contract added = lifecycle.addLineItem(contract, LineItem.charge(null, "PARKING", new BigDecimal("500"), null));
        assertEquals(new BigDecimal("1650.00"), added.getChargesTotal());
        assertEquals(new BigDecimal("14250.00"), added.getGrandTotal());

        UUID chargeId = added.getLineItems().get(1).getId();
        Contract removed = lifecycle.removeLineItem(added, chargeId);
        assertEquals(new BigDecimal("500.00"), removed.getChargesTotal());
        assertEquals(new BigDecimal("13100.00"), removed.getGrandTotal());
    }

    @Test
    @DisplayName("An approved contract refuses every change")
    void approvedContractIsLocked() {
        Contract approved = lifecycle.withApproval(contract(), ApprovalRecord.of(ApprovalStatus.APPROVED));
        UUID unitId = approved.getLineItems().get(0).getId();

        assertThrows(ProtectedDocumentException.class, () -> lifecycle.updateDetails(approved, details()));
        assertThrows(ProtectedDocumentException.class,
                () -> lifecycle.recalculateLineItem(approved, unitId, LineItemField.BASE_AMOUNT, "2000"));
        assertThrows(ProtectedDocumentException.class, () -> lifecycle.addLineItem(approved, unit("10")));
        assertThrows(ProtectedDocumentException.class, () -> lifecycle.removeLineItem(approved, unitId));
        assertThrows(ProtectedDocumentException.class, () -> lifecycle.checkCanDelete(approved));
    }

    @Test
    @DisplayName("Unknown line items and missing header fields are rejected")
    void validation() {
        Contract contract = contract();

        assertThrows(ValidationException.class,
                () -> lifecycle.recalculateLineItem(contract, UUID.randomUUID(), LineItemField.TAX_RATE, null));
        assertThrows(ValidationException.class, () -> lifecycle.create(UUID.randomUUID(),
                ContractDetails.builder().contractNo("LC-1").build(), List.of()));
        assertThrows(ValidationException.class, () -> lifecycle.addLineItem(contract,
                LineItem.charge(null, " ", BigDecimal.ONE, null)));
    }
}
