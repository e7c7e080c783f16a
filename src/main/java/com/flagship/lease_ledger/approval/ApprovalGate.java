package com.flagship.lease_ledger.approval;

import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.exception.IllegalTransitionException;
import com.flagship.lease_ledger.exception.ProtectedDocumentException;
import com.flagship.lease_ledger.exception.UnauthorizedActionException;
import com.flagship.lease_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Approval state machine shared by contracts and receipts.
 *
 * Every method takes the current {@link ApprovalRecord} and returns a new one; nothing is
 * persisted here. Services call {@link #requireMutable} before any change to a document, which
 * is what keeps an approved document locked regardless of which API the change arrives through.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApprovalGate {

    private final LeaseLedgerProperties properties;
    private final ActorAuthorization actorAuthorization;

    /**
     * True when the amount meets or exceeds the configured threshold.
     */
    public boolean requiresApproval(BigDecimal amount) {
        BigDecimal threshold = properties.getApproval().getThreshold();
        return threshold != null && amount != null && amount.compareTo(threshold) >= 0;
    }

    /**
     * Approval state for a newly created document.
     */
    public ApprovalRecord initial(BigDecimal amount) {
        return ApprovalRecord.of(requiresApproval(amount) ? ApprovalStatus.PENDING : ApprovalStatus.NOT_REQUIRED);
    }

    /**
     * Auto-submits a document whose amount has just crossed the threshold.
     * Any other state is left alone.
     */
    public ApprovalRecord onAmountChanged(DocumentRef document, ApprovalRecord current, BigDecimal newAmount) {
        if (current.getStatus() == ApprovalStatus.NOT_REQUIRED && requiresApproval(newAmount)) {
            log.info("{} amount {} reached the approval threshold, submitting for approval", document, newAmount);
            return ApprovalRecord.of(ApprovalStatus.PENDING);
        }
        return current;
    }

    /**
     * NOT_REQUIRED or REJECTED to PENDING. Submitting a PENDING document changes nothing.
     *
     * @throws ProtectedDocumentException if the document is approved
     */
    public ApprovalRecord submit(DocumentRef document, ApprovalRecord current) {
        requireMutable(document, current, "submit for approval");
        if (current.isPending()) {
            return current;
        }
        return ApprovalRecord.of(ApprovalStatus.PENDING);
    }

    /**
     * PENDING to APPROVED.
     *
     * @throws ProtectedDocumentException if the document is already approved
     */
    public ApprovalRecord approve(DocumentRef document, ApprovalRecord current, String actor, String comment) {
        authorize(actor, ApprovalAction.APPROVE);
        requireMutable(document, current, "approve");
        requirePending(document, current, "approve");
        return new ApprovalRecord(ApprovalStatus.APPROVED, blankToNull(comment), null, actor, Instant.now());
    }

    /**
     * PENDING to REJECTED. A non-empty reason is mandatory.
     */
    public ApprovalRecord reject(DocumentRef document, ApprovalRecord current, String actor, String reason) {
        requireReason(reason);
        authorize(actor, ApprovalAction.REJECT);
        requireMutable(document, current, "reject");
        requirePending(document, current, "reject");
        return new ApprovalRecord(ApprovalStatus.REJECTED, null, reason.trim(), actor, Instant.now());
    }

    /**
     * APPROVED or REJECTED back to PENDING. The only way to unlock an approved document.
     */
    public ApprovalRecord reset(DocumentRef document, ApprovalRecord current, String actor) {
        authorize(actor, ApprovalAction.RESET);
        if (current.getStatus() != ApprovalStatus.APPROVED && current.getStatus() != ApprovalStatus.REJECTED) {
            throw new IllegalTransitionException(String.format(
                "Cannot reset approval of %s in %s status. Only APPROVED or REJECTED documents can be reset.",
                document, current.getStatus()));
        }
        return new ApprovalRecord(ApprovalStatus.PENDING, null, null, actor, Instant.now());
    }

    /**
     * @throws ProtectedDocumentException if the document is approved
     */
    public void requireMutable(DocumentRef document, ApprovalRecord current, String operation) {
        if (current.isApproved()) {
            log.warn("Rejected {} on approved {}", operation, document);
            throw new ProtectedDocumentException(document, operation);
        }
    }

    /**
     * @throws UnauthorizedActionException if the actor lacks the capability
     */
    public void authorize(String actor, ApprovalAction action) {
        if (!actorAuthorization.isAuthorized(actor, action)) {
            log.warn("Actor '{}' denied {}", actor, action);
            throw new UnauthorizedActionException(actor, action.name().toLowerCase());
        }
    }

    public void requireReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A rejection reason is required");
        }
    }

    private void requirePending(DocumentRef document, ApprovalRecord current, String operation) {
        if (!current.isPending()) {
            throw new IllegalTransitionException(String.format(
                "Cannot %s %s in %s status. Only PENDING documents can be decided.",
                operation, document, current.getStatus()));
        }
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text.trim();
    }
}
