package com.flagship.lease_ledger.approval;

import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.exception.IllegalTransitionException;
import com.flagship.lease_ledger.exception.ProtectedDocumentException;
import com.flagship.lease_ledger.exception.UnauthorizedActionException;
import com.flagship.lease_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalGateTest {

    private static final String MANAGER = "finance.manager";
    private static final String DIRECTOR = "finance.director";

    private final DocumentRef receipt = DocumentRef.receipt(UUID.randomUUID());
    private ApprovalGate gate;

    @BeforeEach
    void setUp() {
        LeaseLedgerProperties properties = new LeaseLedgerProperties();
        properties.getApproval().setThreshold(new BigDecimal("50000.00"));
        properties.getApproval().getApprovers().setApprove(List.of(MANAGER, DIRECTOR));
        properties.getApproval().getApprovers().setReject(List.of(MANAGER));
        properties.getApproval().getApprovers().setReset(List.of(DIRECTOR));
        gate = new ApprovalGate(properties, new ConfiguredActorAuthorization(properties));
    }

    @Test
    @DisplayName("Amounts at or above the threshold start PENDING, below start NOT_REQUIRED")
    void initialStatus() {
        assertEquals(ApprovalStatus.PENDING, gate.initial(new BigDecimal("50000.00")).getStatus());
        assertEquals(ApprovalStatus.NOT_REQUIRED, gate.initial(new BigDecimal("49999.99")).getStatus());
    }

    @Test
    @DisplayName("Crossing the threshold auto-submits a NOT_REQUIRED document")
    void autoSubmit() {
        ApprovalRecord current = ApprovalRecord.of(ApprovalStatus.NOT_REQUIRED);

        assertEquals(ApprovalStatus.PENDING,
                gate.onAmountChanged(receipt, current, new BigDecimal("60000")).getStatus());
        assertSame(current, gate.onAmountChanged(receipt, current, new BigDecimal("100")));
    }

    @Test
    @DisplayName("Submitting a pending document is a no-op")
    void submitPending() {
        ApprovalRecord pending = ApprovalRecord.of(ApprovalStatus.PENDING);

        assertSame(pending, gate.submit(receipt, pending));
        assertEquals(ApprovalStatus.PENDING,
                gate.submit(receipt, ApprovalRecord.of(ApprovalStatus.REJECTED)).getStatus());
    }

    @Test
    @DisplayName("Approve records actor and comment")
    void approve() {
        ApprovalRecord approved = gate.approve(receipt, ApprovalRecord.of(ApprovalStatus.PENDING), MANAGER, " ok ");

        assertEquals(ApprovalStatus.APPROVED, approved.getStatus());
        assertEquals(MANAGER, approved.getDecidedBy());
        assertEquals("ok", approved.getComment());
        assertNotNull(approved.getDecidedAt());
    }

    @Test
    @DisplayName("Only PENDING documents can be approved or rejected")
    void decideRequiresPending() {
        assertThrows(IllegalTransitionException.class,
                () -> gate.approve(receipt, ApprovalRecord.of(ApprovalStatus.NOT_REQUIRED), MANAGER, null));
        assertThrows(IllegalTransitionException.class,
                () -> gate.reject(receipt, ApprovalRecord.of(ApprovalStatus.REJECTED), MANAGER, "late"));
    }

    @Test
    @DisplayName("Reject requires a reason")
    void rejectNeedsReason() {
        assertThrows(ValidationException.class,
                () -> gate.reject(receipt, ApprovalRecord.of(ApprovalStatus.PENDING), MANAGER, "  "));

        ApprovalRecord rejected = gate.reject(receipt, ApprovalRecord.of(ApprovalStatus.PENDING), MANAGER, "wrong amount");
        assertEquals(ApprovalStatus.REJECTED, rejected.getStatus());
        assertEquals("wrong amount", rejected.getRejectionReason());
    }

    @Test
    @DisplayName("Actors without the capability are refused")
    void unauthorizedActor() {
        ApprovalRecord pending = ApprovalRecord.of(ApprovalStatus.PENDING);

        assertThrows(UnauthorizedActionException.class, () -> gate.approve(receipt, pending, "clerk", null));
        assertThrows(UnauthorizedActionException.class, () -> gate.approve(receipt, pending, null, null));
        assertThrows(UnauthorizedActionException.class,
                () -> gate.reset(receipt, ApprovalRecord.of(ApprovalStatus.APPROVED), MANAGER));
    }

    @Test
    @DisplayName("Reset returns APPROVED or REJECTED documents to PENDING")
    void reset() {
        assertEquals(ApprovalStatus.PENDING,
                gate.reset(receipt, ApprovalRecord.of(ApprovalStatus.APPROVED), DIRECTOR).getStatus());
        assertEquals(ApprovalStatus.PENDING,
                gate.reset(receipt, ApprovalRecord.of(ApprovalStatus.REJECTED), DIRECTOR).getStatus());
        assertThrows(IllegalTransitionException.class,
                () -> gate.reset(receipt, ApprovalRecord.of(ApprovalStatus.PENDING), DIRECTOR));
    }

    @Test
    @DisplayName("Approved documents refuse mutation, submission and a second decision")
    void approvedIsProtected() {
        ApprovalRecord approved = ApprovalRecord.of(ApprovalStatus.APPROVED);

        assertThrows(ProtectedDocumentException.class, () -> gate.requireMutable(receipt, approved, "edit"));
        assertThrows(ProtectedDocumentException.class, () -> gate.submit(receipt, approved));
        assertThrows(ProtectedDocumentException.class, () -> gate.approve(receipt, approved, MANAGER, null));
        assertThrows(ProtectedDocumentException.class, () -> gate.reject(receipt, approved, MANAGER, "bad"));
        assertDoesNotThrow(() -> gate.requireMutable(receipt, ApprovalRecord.of(ApprovalStatus.REJECTED), "edit"));
    }
}
