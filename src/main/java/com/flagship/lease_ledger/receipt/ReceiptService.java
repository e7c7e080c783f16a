package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.allocation.Allocation;
import com.flagship.lease_ledger.allocation.AllocationEngine;
import com.flagship.lease_ledger.allocation.AllocationMode;
import com.flagship.lease_ledger.allocation.AllocationProposal;
import com.flagship.lease_ledger.approval.ApprovalAction;
import com.flagship.lease_ledger.approval.ApprovalGate;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.document.BulkDocumentProcessor;
import com.flagship.lease_ledger.document.BulkOutcome;
import com.flagship.lease_ledger.document.BulkResult;
import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.document.event.ApprovalStatusChangedEvent;
import com.flagship.lease_ledger.document.event.DocumentPostedEvent;
import com.flagship.lease_ledger.document.event.PostingReversedEvent;
import com.flagship.lease_ledger.exception.DocumentNotFoundException;
import com.flagship.lease_ledger.exception.NotPostedException;
import com.flagship.lease_ledger.exception.ValidationException;
import com.flagship.lease_ledger.ledger.Posting;
import com.flagship.lease_ledger.ledger.PostingLedger;
import com.flagship.lease_ledger.ledger.PostingRequest;
import com.flagship.lease_ledger.ledger.PostingResult;
import com.flagship.lease_ledger.ledger.ReversalResult;
import com.flagship.lease_ledger.observability.CorrelationContext;
import com.flagship.lease_ledger.observability.LedgerMetrics;
import com.flagship.lease_ledger.outbox.OutboxService;
import com.flagship.lease_ledger.receipt.event.PaymentStatusChangedEvent;
import com.flagship.lease_ledger.receipt.event.ReceiptCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Receipt use cases.
 *
 * Every mutating call runs in one transaction: the receipt is row-locked, checked by
 * {@link ReceiptLifecycle}, written with a version check, and its event goes to the outbox in
 * the same transaction. Ledger writes join that transaction, so a posting and the receipt's
 * posted flag commit or roll back together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptService {

    private static final String DOCUMENT_TYPE = DocumentType.RECEIPT.getAggregateName();

    private final ReceiptLifecycle lifecycle;
    private final ReceiptPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final AllocationEngine allocationEngine;
    private final ApprovalGate approvalGate;
    private final PostingLedger postingLedger;
    private final BulkDocumentProcessor bulkProcessor;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Creates a receipt once per idempotency key. A repeated key returns the receipt created the
     * first time, whatever the new request body says.
     */
    @Transactional
    public ReceiptCreation create(ReceiptDetails details, String idempotencyKey, String actor) {
        Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingId.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key {} already used, returning receipt {}", idempotencyKey, existingId.get());
            Receipt existing = persistenceService.findById(existingId.get())
                .orElseThrow(() -> new IllegalStateException(
                    "Receipt found by idempotency key but not by ID: " + existingId.get()));
            return new ReceiptCreation(existing, false);
        }
        metrics.recordIdempotencyMiss();

        UUID receiptId = UUID.randomUUID();
        Receipt saved = track("create", receiptId, () -> {
            Receipt receipt = lifecycle.create(receiptId, details);
            Receipt persisted = persistenceService.save(receipt, idempotencyKey);
            outboxService.saveEvent(ReceiptCreatedEvent.fromReceipt(persisted));
            log.info("Receipt {} created by {}: net={}, paymentStatus={}, approval={}",
                    persisted.getReceiptNo(), actor, persisted.getNetAmount(),
                    persisted.getPaymentStatus(), persisted.getApproval().getStatus());
            return persisted;
        });
        idempotencyService.storeIdempotencyKey(idempotencyKey, saved.getId());
        return new ReceiptCreation(saved, true);
    }

    @Transactional(readOnly = true)
    public Receipt get(UUID receiptId) {
        return persistenceService.findById(receiptId)
            .orElseThrow(() -> new DocumentNotFoundException(DocumentRef.receipt(receiptId)));
    }

    @Transactional
    public Receipt update(UUID receiptId, ReceiptDetails details, String actor) {
        return track("update", receiptId, () -> {
            Receipt current = persistenceService.lock(receiptId);
            Receipt updated = persistenceService.update(lifecycle.update(current, details));
            publishApprovalChange(current, updated, actor);
            log.info("Receipt updated by {}: net={}", actor, updated.getNetAmount());
            return updated;
        });
    }

    @Transactional
    public void delete(UUID receiptId, String actor) {
        track("delete", receiptId, () -> {
            Receipt current = persistenceService.lock(receiptId);
            lifecycle.checkCanDelete(current);
            persistenceService.delete(current);
            log.info("Receipt {} deleted by {}", current.getReceiptNo(), actor);
            return current;
        });
    }

    @Transactional
    public Receipt changePaymentStatus(UUID receiptId, PaymentStatusChange change, String actor) {
        return track("payment_status", receiptId, () -> {
            Receipt current = persistenceService.lock(receiptId);
            Receipt next = lifecycle.changePaymentStatus(current, change);
            if (next == current) {
                return current;
            }
            Receipt updated = persistenceService.update(next);
            outboxService.saveEvent(PaymentStatusChangedEvent.of(current.getPaymentStatus(), updated, actor));
            log.info("Payment status {} -> {} by {}", current.getPaymentStatus(), updated.getPaymentStatus(), actor);
            return updated;
        });
    }

    /**
     * Dry run: what the engine would allocate. Nothing is stored.
     */
    @Transactional(readOnly = true)
    public AllocationProposal proposeAllocation(UUID receiptId, AllocationMode mode, List<Allocation> entries) {
        Receipt receipt = get(receiptId);
        return allocationEngine.propose(receipt.getNetAmount(), mode, entries);
    }

    /**
     * Replaces the receipt's allocations with a fresh proposal.
     */
    @Transactional
    public Receipt commitAllocation(UUID receiptId, AllocationMode mode, List<Allocation> entries, String actor) {
        return track("allocate", receiptId, () -> {
            Receipt current = persistenceService.lock(receiptId);
            approvalGate.requireMutable(current.ref(), current.getApproval(), "change allocations");
            AllocationProposal proposal = allocationEngine.propose(current.getNetAmount(), mode, entries);
            Receipt updated = persistenceService.update(lifecycle.applyAllocations(current, proposal));
            log.info("Allocations committed by {}: mode={}, allocated={}, unallocated={}",
                    actor, mode, proposal.getAllocatedAmount(), proposal.getUnallocatedAmount());
            return updated;
        });
    }

    @Transactional
    public Receipt submit(UUID receiptId, String actor) {
        return decide("submit", receiptId, actor,
                receipt -> approvalGate.submit(receipt.ref(), receipt.getApproval()));
    }

    @Transactional
    public Receipt approve(UUID receiptId, String actor, String comment) {
        return decide("approve", receiptId, actor,
                receipt -> approvalGate.approve(receipt.ref(), receipt.getApproval(), actor, comment));
    }

    @Transactional
    public Receipt reject(UUID receiptId, String actor, String reason) {
        return decide("reject", receiptId, actor,
                receipt -> approvalGate.reject(receipt.ref(), receipt.getApproval(), actor, reason));
    }

    @Transactional
    public Receipt reset(UUID receiptId, String actor) {
        return decide("reset", receiptId, actor,
                receipt -> approvalGate.reset(receipt.ref(), receipt.getApproval(), actor));
    }

    /**
     * Approves or rejects many receipts, each in its own transaction. Receipts that do not
     * exist or are not PENDING are skipped.
     */
    public BulkResult bulkApproval(List<UUID> receiptIds, ApprovalAction action, String text, String actor) {
        if (action != ApprovalAction.APPROVE && action != ApprovalAction.REJECT) {
            throw new ValidationException("Bulk approval supports APPROVE or REJECT, not " + action);
        }
        if (action == ApprovalAction.REJECT) {
            approvalGate.requireReason(text);
        }
        approvalGate.authorize(actor, action);

        BulkResult result = bulkProcessor.process("receipt_" + action.name().toLowerCase(), receiptIds, id -> {
            Optional<Receipt> locked = persistenceService.tryLock(id);
            if (locked.isEmpty() || !locked.get().getApproval().isPending()) {
                return BulkOutcome.SKIPPED;
            }
            Receipt current = locked.get();
            ApprovalRecord decided = action == ApprovalAction.APPROVE
                ? approvalGate.approve(current.ref(), current.getApproval(), actor, text)
                : approvalGate.reject(current.ref(), current.getApproval(), actor, text);
            Receipt updated = persistenceService.update(lifecycle.withApproval(current, decided));
            publishApprovalChange(current, updated, actor);
            return BulkOutcome.APPLIED;
        });
        metrics.recordBulkResult("receipt_" + action.name().toLowerCase(), result);
        return result;
    }

    /**
     * Posts the receipt's net amount as one debit and one credit under a new voucher.
     */
    @Transactional
    public PostingResult post(UUID receiptId, PostingInstruction instruction, String actor) {
        return track("post", receiptId, () -> postLocked(persistenceService.lock(receiptId), instruction, actor));
    }

    /**
     * Posts many receipts, each in its own transaction. Missing or already posted receipts are
     * skipped; receipts refused by the posting rules count as failed.
     */
    public BulkResult bulkPost(List<UUID> receiptIds, PostingInstruction instruction, String actor) {
        BulkResult result = bulkProcessor.process("receipt_post", receiptIds, id -> {
            Optional<Receipt> locked = persistenceService.tryLock(id);
            if (locked.isEmpty() || locked.get().isPosted()) {
                return BulkOutcome.SKIPPED;
            }
            postLocked(locked.get(), instruction, actor);
            return BulkOutcome.APPLIED;
        });
        metrics.recordBulkResult("receipt_post", result);
        return result;
    }

    /**
     * Reverses the voucher a posting belongs to and clears the receipt's posted flag.
     */
    @Transactional
    public ReversalResult reversePosting(UUID postingId, String reason, LocalDate reversalDate, String actor) {
        Posting posting = postingLedger.findById(postingId)
            .orElseThrow(() -> new NotPostedException("Posting not found: " + postingId));
        if (posting.getDocument().getType() != DocumentType.RECEIPT) {
            throw new NotPostedException("Posting " + postingId + " does not belong to a receipt");
        }

        UUID receiptId = posting.getDocument().getId();
        return track("reverse", receiptId, () -> {
            Receipt current = persistenceService.lock(receiptId);
            lifecycle.checkCanReverse(current, postingLedger.hasActivePostings(current.ref()));
            ReversalResult reversal = postingLedger.reverse(postingId, reason, reversalDate, actor);
            persistenceService.update(lifecycle.markUnposted(current));
            outboxService.saveEvent(PostingReversedEvent.of(reversal, actor));
            metrics.recordVoucherWritten("reversal");
            log.info("Voucher {} reversed by {} with {}", reversal.getReversedVoucherNo(), actor,
                    reversal.getReversalVoucherNo());
            return reversal;
        });
    }

    @Transactional(readOnly = true)
    public List<Posting> postings(UUID receiptId) {
        Receipt receipt = get(receiptId);
        return postingLedger.findByDocument(receipt.ref());
    }

    private PostingResult postLocked(Receipt current, PostingInstruction instruction, String actor) {
        lifecycle.checkCanPost(current);
        PostingRequest request = new PostingRequest(
            instruction.getPostingDate() != null ? instruction.getPostingDate() : current.getReceiptDate(),
            instruction.getDebitAccountRef(),
            instruction.getCreditAccountRef(),
            current.getNetAmount(),
            instruction.getNarration() != null ? instruction.getNarration() : "Receipt " + current.getReceiptNo()
        );

        PostingResult result = postingLedger.post(current.ref(), request, actor);
        persistenceService.update(lifecycle.markPosted(current, result.getVoucherNo()));
        outboxService.saveEvent(DocumentPostedEvent.of(result, request, actor));
        metrics.recordVoucherWritten("posting");
        log.info("Receipt {} posted by {}: voucher={}, amount={}", current.getReceiptNo(), actor,
                result.getVoucherNo(), request.getAmount());
        return result;
    }

    private Receipt decide(String operation, UUID receiptId, String actor,
                           Function<Receipt, ApprovalRecord> decision) {
        return track(operation, receiptId, () -> {
            Receipt current = persistenceService.lock(receiptId);
            ApprovalRecord next = decision.apply(current);
            if (next == current.getApproval()) {
                return current;
            }
            Receipt updated = persistenceService.update(lifecycle.withApproval(current, next));
            publishApprovalChange(current, updated, actor);
            return updated;
        });
    }

    private void publishApprovalChange(Receipt before, Receipt after, String actor) {
        ApprovalStatus previous = before.getApproval().getStatus();
        if (previous != after.getApproval().getStatus()) {
            outboxService.saveEvent(ApprovalStatusChangedEvent.of(after.ref(), previous, after.getApproval(), actor));
            log.info("Approval {} -> {} by {}", previous, after.getApproval().getStatus(), actor);
        }
    }

    /**
     * Runs an operation with the receipt id in MDC, recording its outcome and latency.
     */
    private <T> T track(String operation, UUID receiptId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.DOCUMENT_ID_MDC_KEY, receiptId.toString());
        try {
            T result = action.get();
            metrics.recordDocumentOperation(DOCUMENT_TYPE, operation, "success");
            return result;
        } catch (RuntimeException e) {
            metrics.recordDocumentOperation(DOCUMENT_TYPE, operation, LedgerMetrics.outcomeOf(e));
            log.warn("Receipt {} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordOperationLatency("receipt_" + operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.DOCUMENT_ID_MDC_KEY);
        }
    }
}
