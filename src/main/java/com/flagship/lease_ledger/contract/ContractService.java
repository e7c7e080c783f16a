package com.flagship.lease_ledger.contract;

import com.flagship.lease_ledger.approval.ApprovalAction;
import com.flagship.lease_ledger.approval.ApprovalGate;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.approval.ApprovalStatus;
import com.flagship.lease_ledger.calculation.Installment;
import com.flagship.lease_ledger.calculation.InstallmentPlanner;
import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.calculation.LineItemField;
import com.flagship.lease_ledger.contract.event.ContractCreatedEvent;
import com.flagship.lease_ledger.contract.event.ContractTotalsChangedEvent;
import com.flagship.lease_ledger.document.BulkDocumentProcessor;
import com.flagship.lease_ledger.document.BulkOutcome;
import com.flagship.lease_ledger.document.BulkResult;
import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.document.event.ApprovalStatusChangedEvent;
import com.flagship.lease_ledger.exception.DocumentNotFoundException;
import com.flagship.lease_ledger.exception.ValidationException;
import com.flagship.lease_ledger.observability.CorrelationContext;
import com.flagship.lease_ledger.observability.LedgerMetrics;
import com.flagship.lease_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Contract use cases. Same shape as the receipt service: lock, check, write with a version
 * check, outbox event in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private static final String DOCUMENT_TYPE = DocumentType.CONTRACT.getAggregateName();

    private final ContractLifecycle lifecycle;
    private final ContractPersistenceService persistenceService;
    private final ApprovalGate approvalGate;
    private final InstallmentPlanner installmentPlanner;
    private final BulkDocumentProcessor bulkProcessor;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    @Transactional
    public Contract create(ContractDetails details, List<LineItem> lineItems, String actor) {
        UUID contractId = UUID.randomUUID();
        return track("create", contractId, () -> {
            Contract saved = persistenceService.save(lifecycle.create(contractId, details, lineItems));
            outboxService.saveEvent(ContractCreatedEvent.fromContract(saved));
            log.info("Contract {} created by {}: lines={}, grandTotal={}, approval={}",
                    saved.getContractNo(), actor, saved.getLineItems().size(), saved.getGrandTotal(),
                    saved.getApproval().getStatus());
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public Contract get(UUID contractId) {
        return persistenceService.findById(contractId)
            .orElseThrow(() -> new DocumentNotFoundException(DocumentRef.contract(contractId)));
    }

    @Transactional
    public Contract updateDetails(UUID contractId, ContractDetails details, String actor) {
        return track("update", contractId, () -> {
            Contract current = persistenceService.lock(contractId);
            Contract updated = persistenceService.update(lifecycle.updateDetails(current, details));
            log.info("Contract header updated by {}", actor);
            return updated;
        });
    }

    @Transactional
    public void delete(UUID contractId, String actor) {
        track("delete", contractId, () -> {
            Contract current = persistenceService.lock(contractId);
            lifecycle.checkCanDelete(current);
            persistenceService.delete(current);
            log.info("Contract {} deleted by {}", current.getContractNo(), actor);
            return current;
        });
    }

    @Transactional
    public Contract addLineItem(UUID contractId, LineItem rawLineItem, String actor) {
        return changeLines("add_line", contractId, actor, current -> lifecycle.addLineItem(current, rawLineItem));
    }

    @Transactional
    public Contract removeLineItem(UUID contractId, UUID lineItemId, String actor) {
        return changeLines("remove_line", contractId, actor, current -> lifecycle.removeLineItem(current, lineItemId));
    }

    /**
     * Applies one field edit to a line item; the item's derived fields and the contract totals
     * are recomputed, and the contract is submitted for approval if it crosses the threshold.
     */
    @Transactional
    public Contract recalculateLineItem(UUID contractId, UUID lineItemId, LineItemField field, Object newValue,
                                        String actor) {
        return changeLines("recalculate", contractId, actor,
                current -> lifecycle.recalculateLineItem(current, lineItemId, field, newValue));
    }

    /**
     * Payment schedule of a unit-term line item.
     */
    @Transactional(readOnly = true)
    public List<Installment> installments(UUID contractId, UUID lineItemId) {
        Contract contract = get(contractId);
        LineItem item = lifecycle.requireLineItem(contract, lineItemId);
        if (!item.isUnitTerm()) {
            throw new ValidationException("Installments are only planned for unit-term line items");
        }
        return installmentPlanner.plan(item);
    }

    @Transactional
    public Contract submit(UUID contractId, String actor) {
        return decide("submit", contractId, actor,
                contract -> approvalGate.submit(contract.ref(), contract.getApproval()));
    }

    @Transactional
    public Contract approve(UUID contractId, String actor, String comment) {
        return decide("approve", contractId, actor,
                contract -> approvalGate.approve(contract.ref(), contract.getApproval(), actor, comment));
    }

    @Transactional
    public Contract reject(UUID contractId, String actor, String reason) {
        return decide("reject", contractId, actor,
                contract -> approvalGate.reject(contract.ref(), contract.getApproval(), actor, reason));
    }

    @Transactional
    public Contract reset(UUID contractId, String actor) {
        return decide("reset", contractId, actor,
                contract -> approvalGate.reset(contract.ref(), contract.getApproval(), actor));
    }

    /**
     * Approves or rejects many contracts, each in its own transaction. Contracts that do not
     * exist or are not PENDING are skipped.
     */
    public BulkResult bulkApproval(List<UUID> contractIds, ApprovalAction action, String text, String actor) {
        if (action != ApprovalAction.APPROVE && action != ApprovalAction.REJECT) {
            throw new ValidationException("Bulk approval supports APPROVE or REJECT, not " + action);
        }
        if (action == ApprovalAction.REJECT) {
            approvalGate.requireReason(text);
        }
        approvalGate.authorize(actor, action);

        String operation = "contract_" + action.name().toLowerCase();
        BulkResult result = bulkProcessor.process(operation, contractIds, id -> {
            Optional<Contract> locked = persistenceService.tryLock(id);
            if (locked.isEmpty() || !locked.get().getApproval().isPending()) {
                return BulkOutcome.SKIPPED;
            }
            Contract current = locked.get();
            ApprovalRecord decided = action == ApprovalAction.APPROVE
                ? approvalGate.approve(current.ref(), current.getApproval(), actor, text)
                : approvalGate.reject(current.ref(), current.getApproval(), actor, text);
            Contract updated = persistenceService.update(lifecycle.withApproval(current, decided));
            publishApprovalChange(current, updated, actor);
            return BulkOutcome.APPLIED;
        });
        metrics.recordBulkResult(operation, result);
        return result;
    }

    private Contract changeLines(String operation, UUID contractId, String actor, Function<Contract, Contract> change) {
        return track(operation, contractId, () -> {
            Contract current = persistenceService.lock(contractId);
            Contract updated = persistenceService.update(change.apply(current));
            if (current.getGrandTotal().compareTo(updated.getGrandTotal()) != 0) {
                outboxService.saveEvent(ContractTotalsChangedEvent.of(operation, current.getGrandTotal(), updated, actor));
            }
            publishApprovalChange(current, updated, actor);
            log.info("Contract {} by {}: grandTotal {} -> {}", operation, actor,
                    current.getGrandTotal(), updated.getGrandTotal());
            return updated;
        });
    }

    private Contract decide(String operation, UUID contractId, String actor,
                            Function<Contract, ApprovalRecord> decision) {
        return track(operation, contractId, () -> {
            Contract current = persistenceService.lock(contractId);
            ApprovalRecord next = decision.apply(current);
            if (next == current.getApproval()) {
                return current;
            }
            Contract updated = persistenceService.update(lifecycle.withApproval(current, next));
            publishApprovalChange(current, updated, actor);
            return updated;
        });
    }

    private void publishApprovalChange(Contract before, Contract after, String actor) {
        ApprovalStatus previous = before.getApproval().getStatus();
        if (previous != after.getApproval().getStatus()) {
            outboxService.saveEvent(ApprovalStatusChangedEvent.of(after.ref(), previous, after.getApproval(), actor));
            log.info("Approval {} -> {} by {}", previous, after.getApproval().getStatus(), actor);
        }
    }

    private <T> T track(String operation, UUID contractId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.DOCUMENT_ID_MDC_KEY, contractId.toString());
        try {
            T result = action.get();
            metrics.recordDocumentOperation(DOCUMENT_TYPE, operation, "success");
            return result;
        } catch (RuntimeException e) {
            metrics.recordDocumentOperation(DOCUMENT_TYPE, operation, LedgerMetrics.outcomeOf(e));
            log.warn("Contract {} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordOperationLatency("contract_" + operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.DOCUMENT_ID_MDC_KEY);
        }
    }
}
