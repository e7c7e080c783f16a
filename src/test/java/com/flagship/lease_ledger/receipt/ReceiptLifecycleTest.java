package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.allocation.Allocation;
import com.flagship.lease_ledger.allocation.AllocationEngine;
import com.flagship.lease_ledger.allocation.AllocationMode;
import com.flagship.lease_ledger.allocation.AllocationProposal;
import com.flagship.lease_ledger.approval.ApprovalGate;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.approval.ConfiguredActorAuthorization;
import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import com.flagship.lease_ledger.exception.AlreadyPostedException;
import com.flagship.lease_ledger.exception.IllegalTransitionException;
import com.flagship.lease_ledger.exception.NotPostedException;
import com.flagship.lease_ledger.exception.OverAllocationException;
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

class ReceiptLifecycleTest {

    private static final LocalDate RECEIPT_DATE = LocalDate.of(2024, 3, 1);
    private static final Map<String, BigDecimal> OUTSTANDING = Map.of(
            "INV-1", new BigDecimal("4000.00"),
            "INV-2", new BigDecimal("3000.00"));

    private ReceiptLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        LeaseLedgerProperties properties = new LeaseLedgerProperties();
        properties.getApproval().setThreshold(new BigDecimal("50000.00"));
        lifecycle = new ReceiptLifecycle(new ApprovalGate(properties, new ConfiguredActorAuthorization(properties)),
                new AllocationEngine(ref -> Optional.ofNullable(OUTSTANDING.get(ref))));
    }

    private ReceiptDetails details(PaymentType type, String received) {
        return ReceiptDetails.builder()
            .receiptNo("RCT-1")
            .customerRef("CUST-9")
            .receiptDate(RECEIPT_DATE)
            .paymentType(type)
            .chequeNo(type == PaymentType.CHEQUE ? "000123" : null)
            .receivedAmount(new BigDecimal(received))
            .securityDeposit(new BigDecimal("1000"))
            .penalty(BigDecimal.ZERO)
            .discount(new BigDecimal("200"))
            .build();
    }

    private Receipt cashReceipt() {
        return lifecycle.create(UUID.randomUUID(), details(PaymentType.CASH, "5000"));
    }

    private Receipt approved(Receipt receipt) {
        return lifecycle.withApproval(receipt, ApprovalRecord.of(ApprovalStatus.APPROVED));
    }

    @Test
    @DisplayName("A new receipt computes its net amount and starts RECEIVED")
    void create() {
        Receipt receipt = cashReceipt();

        assertEquals(new BigDecimal("5800.00"), receipt.getNetAmount());
        assertEquals(new BigDecimal("5800.00"), receipt.getUnallocatedAmount());
        assertEquals(PaymentStatus.RECEIVED, receipt.getPaymentStatus());
        assertEquals(ApprovalStatus.NOT_REQUIRED, receipt.getApproval().getStatus());
        assertFalse(receipt.isPosted());
    }

    @Test
    @DisplayName("Large receipts start PENDING approval")
    void largeReceiptNeedsApproval() {
        Receipt receipt = lifecycle.create(UUID.randomUUID(), details(PaymentType.BANK_TRANSFER, "60000"));

        assertEquals(ApprovalStatus.PENDING, receipt.getApproval().getStatus());
    }

    @Test
    @DisplayName("Cheque receipts need a cheque number")
    void chequeNeedsNumber() {
        ReceiptDetails noCheque = details(PaymentType.CHEQUE, "100").toBuilder().chequeNo(null).build();

        assertThrows(ValidationException.class, () -> lifecycle.create(UUID.randomUUID(), noCheque));
    }

    @Test
    @DisplayName("Cash goes RECEIVED -> DEPOSITED -> CLEARED with dates in order")
    void cashDepositAndClearance() {
        Receipt deposited = lifecycle.changePaymentStatus(cashReceipt(),
                new PaymentStatusChange(PaymentStatus.DEPOSITED, "BANK-1", RECEIPT_DATE.plusDays(1), null, null));
        assertEquals("BANK-1", deposited.getDepositBankRef());

        assertThrows(ValidationException.class, () -> lifecycle.changePaymentStatus(deposited,
                new PaymentStatusChange(PaymentStatus.CLEARED, null, null, RECEIPT_DATE, null)));

        Receipt cleared = lifecycle.changePaymentStatus(deposited,
                new PaymentStatusChange(PaymentStatus.CLEARED, null, null, RECEIPT_DATE.plusDays(3), null));
        assertEquals(PaymentStatus.CLEARED, cleared.getPaymentStatus());
    }

    @Test
    @DisplayName("Deposit needs a bank and a date not before the receipt date")
    void depositValidation() {
        Receipt receipt = cashReceipt();

        assertThrows(ValidationException.class, () -> lifecycle.changePaymentStatus(receipt,
                new PaymentStatusChange(PaymentStatus.DEPOSITED, null, RECEIPT_DATE, null, null)));
        assertThrows(ValidationException.class, () -> lifecycle.changePaymentStatus(receipt,
                new PaymentStatusChange(PaymentStatus.DEPOSITED, "BANK-1", RECEIPT_DATE.minusDays(1), null, null)));
    }

    @Test
    @DisplayName("Electronic payments clear without a deposit and cannot be deposited")
    void electronicPayments() {
        Receipt transfer = lifecycle.create(UUID.randomUUID(), details(PaymentType.BANK_TRANSFER, "100"));

        assertThrows(IllegalTransitionException.class, () -> lifecycle.changePaymentStatus(transfer,
                new PaymentStatusChange(PaymentStatus.DEPOSITED, "BANK-1", RECEIPT_DATE, null, null)));
        Receipt cleared = lifecycle.changePaymentStatus(transfer,
                new PaymentStatusChange(PaymentStatus.CLEARED, null, null, RECEIPT_DATE, null));
        assertEquals(PaymentStatus.CLEARED, cleared.getPaymentStatus());
    }

    @Test
    @DisplayName("Bounced receipts can be corrected back to RECEIVED but not deleted")
    void bouncedReceipt() {
        Receipt bounced = lifecycle.changePaymentStatus(cashReceipt(), PaymentStatusChange.to(PaymentStatus.BOUNCED));

        assertThrows(IllegalTransitionException.class, () -> lifecycle.checkCanDelete(bounced));
        Receipt corrected = lifecycle.changePaymentStatus(bounced, PaymentStatusChange.to(PaymentStatus.RECEIVED));
        assertEquals(PaymentStatus.RECEIVED, corrected.getPaymentStatus());
    }

    @Test
    @DisplayName("Approved receipts refuse every mutation")
    void approvedReceiptIsProtected() {
        Receipt receipt = approved(cashReceipt());
        AllocationProposal proposal = new AllocationProposal(AllocationMode.SINGLE, receipt.getNetAmount(),
                List.of(), BigDecimal.ZERO, receipt.getNetAmount());

        assertThrows(ProtectedDocumentException.class,
                () -> lifecycle.update(receipt, details(PaymentType.CASH, "1")));
        assertThrows(ProtectedDocumentException.class,
                () -> lifecycle.changePaymentStatus(receipt, PaymentStatusChange.to(PaymentStatus.CANCELLED)));
        assertThrows(ProtectedDocumentException.class, () -> lifecycle.checkCanDelete(receipt));
        assertThrows(ProtectedDocumentException.class, () -> lifecycle.applyAllocations(receipt, proposal));
    }

    @Test
    @DisplayName("Editing the amount re-derives a SINGLE allocation from the new net amount")
    void updateRederivesSingleAllocation() {
        Receipt receipt = cashReceipt();
        Receipt allocated = lifecycle.applyAllocations(receipt, new AllocationProposal(AllocationMode.SINGLE,
                receipt.getNetAmount(), List.of(Allocation.of("INV-1", new BigDecimal("4000.00"))),
                new BigDecimal("4000.00"), new BigDecimal("1800.00")));

        Receipt shrunk = lifecycle.update(allocated, details(PaymentType.CASH, "2000"));
        assertEquals(new BigDecimal("2800.00"), shrunk.getNetAmount());
        assertEquals(AllocationMode.SINGLE, shrunk.getAllocationMode());
        assertEquals(List.of(Allocation.of("INV-1", new BigDecimal("2800.00"))), shrunk.getAllocations());
        assertEquals(new BigDecimal("0.00"), shrunk.getUnallocatedAmount());

        Receipt grown = lifecycle.update(shrunk, details(PaymentType.CASH, "6000"));
        assertEquals(new BigDecimal("6800.00"), grown.getNetAmount());
        assertEquals(List.of(Allocation.of("INV-1", new BigDecimal("4000.00"))), grown.getAllocations());
        assertEquals(new BigDecimal("2800.00"), grown.getUnallocatedAmount());
    }

    @Test
    @DisplayName("An edit that shrinks the net amount below MULTIPLE allocations is rejected")
    void updateBelowMultipleAllocations() {
        Receipt receipt = cashReceipt();
        Receipt allocated = lifecycle.applyAllocations(receipt, new AllocationProposal(AllocationMode.MULTIPLE,
                receipt.getNetAmount(), List.of(Allocation.of("INV-1", new BigDecimal("3000.00")),
                        Allocation.of("INV-2", new BigDecimal("1000.00"))),
                new BigDecimal("4000.00"), new BigDecimal("1800.00")));

        assertThrows(OverAllocationException.class,
                () -> lifecycle.update(allocated, details(PaymentType.CASH, "2000")));

        Receipt updated = lifecycle.update(allocated, details(PaymentType.CASH, "6000"));
        assertEquals(new BigDecimal("6800.00"), updated.getNetAmount());
        assertEquals(allocated.getAllocations(), updated.getAllocations());
        assertEquals(new BigDecimal("2800.00"), updated.getUnallocatedAmount());
    }

    @Test
    @DisplayName("Posting needs approval, a postable status and no earlier posting")
    void postingEligibility() {
        Receipt receipt = cashReceipt();
        assertDoesNotThrow(() -> lifecycle.checkCanPost(receipt));

        Receipt pending = lifecycle.withApproval(receipt, ApprovalRecord.of(ApprovalStatus.PENDING));
        assertThrows(IllegalTransitionException.class, () -> lifecycle.checkCanPost(pending));

        Receipt cancelled = lifecycle.changePaymentStatus(receipt, PaymentStatusChange.to(PaymentStatus.CANCELLED));
        assertThrows(IllegalTransitionException.class, () -> lifecycle.checkCanPost(cancelled));

        Receipt posted = lifecycle.markPosted(receipt, "JV-20240301-ABCDEF12");
        assertThrows(AlreadyPostedException.class, () -> lifecycle.checkCanPost(posted));
        assertDoesNotThrow(() -> lifecycle.checkCanPost(approved(receipt)));
    }

    @Test
    @DisplayName("Posted receipts cannot be edited or deleted, and only posted ones can be reversed")
    void postedReceipt() {
        Receipt posted = lifecycle.markPosted(cashReceipt(), "JV-20240301-ABCDEF12");

        assertThrows(IllegalTransitionException.class, () -> lifecycle.update(posted, details(PaymentType.CASH, "10")));
        assertThrows(IllegalTransitionException.class, () -> lifecycle.checkCanDelete(posted));
        assertDoesNotThrow(() -> lifecycle.checkCanReverse(posted, true));
        assertThrows(NotPostedException.class, () -> lifecycle.checkCanReverse(cashReceipt(), false));
    }
}
