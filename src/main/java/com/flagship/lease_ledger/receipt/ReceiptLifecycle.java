package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.allocation.Allocation;
import com.flagship.lease_ledger.allocation.AllocationEngine;
import com.flagship.lease_ledger.allocation.AllocationMode;
import com.flagship.lease_ledger.allocation.AllocationProposal;
import com.flagship.lease_ledger.approval.ApprovalGate;
import com.flagship.lease_ledger.approval.ApprovalRecord;
import com.flagship.lease_ledger.calculation.MoneyRounding;
import com.flagship.lease_ledger.exception.AlreadyPostedException;
import com.flagship.lease_ledger.exception.IllegalTransitionException;
import com.flagship.lease_ledger.exception.NotPostedException;
import com.flagship.lease_ledger.exception.OverAllocationException;
import com.flagship.lease_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Receipt state machine: payment status, edit and delete guards, posting eligibility.
 *
 * Payment status transitions:
 * - PENDING -> RECEIVED
 * - RECEIVED -> DEPOSITED (cash and cheque only; bank and deposit date required)
 * - DEPOSITED -> CLEARED (clearance date required)
 * - RECEIVED -> CLEARED (electronic payment types only)
 * - any -> BOUNCED, CANCELLED
 * - BOUNCED, CANCELLED -> RECEIVED (manual correction)
 *
 * All checks run before a new instance is built, so a rejected call never produces a
 * partially changed receipt.
 */
@Component
@RequiredArgsConstructor
public class ReceiptLifecycle {

    private static final Set<PaymentStatus> POSTABLE_STATUSES = EnumSet.of(PaymentStatus.RECEIVED, PaymentStatus.CLEARED);
    private static final Set<PaymentStatus> CREATION_STATUSES = EnumSet.of(PaymentStatus.PENDING, PaymentStatus.RECEIVED);

    private final ApprovalGate approvalGate;
    private final AllocationEngine allocationEngine;

    /**
     * Builds a new receipt. Approval starts PENDING when the net amount meets the threshold.
     */
    public Receipt create(UUID id, ReceiptDetails details) {
        validate(details);
        PaymentStatus status = details.getInitialStatus() != null ? details.getInitialStatus() : PaymentStatus.RECEIVED;
        if (!CREATION_STATUSES.contains(status)) {
            throw new ValidationException("A receipt starts as PENDING or RECEIVED, not " + status);
        }

        BigDecimal net = netAmount(details);
        Instant now = Instant.now();
        return applyDetails(Receipt.builder(), details)
            .id(id)
            .netAmount(net)
            .allocations(List.of())
            .unallocatedAmount(net)
            .paymentStatus(status)
            .approval(approvalGate.initial(net))
            .posted(false)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Replaces the editable fields. A SINGLE allocation is derived again from the new net amount;
     * explicit MULTIPLE or PROPORTIONAL allocations must still fit it.
     */
    public Receipt update(Receipt receipt, ReceiptDetails details) {
        approvalGate.requireMutable(receipt.ref(), receipt.getApproval(), "edit");
        if (receipt.isPosted()) {
            throw new IllegalTransitionException(receipt.ref() + " is posted and cannot be edited. Reverse the posting first.");
        }
        validate(details);

        BigDecimal net = netAmount(details);
        List<Allocation> allocations = receipt.getAllocations();
        BigDecimal unallocated;
        if (receipt.getAllocationMode() == AllocationMode.SINGLE && allocations != null && !allocations.isEmpty()) {
            AllocationProposal proposal = allocationEngine.propose(net, AllocationMode.SINGLE, allocations);
            allocations = proposal.getAllocations();
            unallocated = proposal.getUnallocatedAmount();
        } else {
            BigDecimal allocated = allocatedTotal(allocations);
            if (allocated.compareTo(net) > 0) {
                throw new OverAllocationException(net, allocated);
            }
            unallocated = MoneyRounding.round2(net.subtract(allocated));
        }

        return applyDetails(receipt.toBuilder(), details)
            .netAmount(net)
            .allocations(allocations)
            .unallocatedAmount(unallocated)
            .approval(approvalGate.onAmountChanged(receipt.ref(), receipt.getApproval(), net))
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * @throws IllegalTransitionException if the move is not allowed from the current status
     * @throws ValidationException if required deposit or clearance data is missing or out of order
     */
    public Receipt changePaymentStatus(Receipt receipt, PaymentStatusChange change) {
        approvalGate.requireMutable(receipt.ref(), receipt.getApproval(), "change payment status");
        PaymentStatus from = receipt.getPaymentStatus();
        PaymentStatus to = change.getTargetStatus();
        if (to == null) {
            throw new ValidationException("Target payment status is required");
        }
        if (from == to) {
            return receipt;
        }

        Receipt.ReceiptBuilder next = receipt.toBuilder().paymentStatus(to).updatedAt(Instant.now());
        switch (to) {
            case RECEIVED:
                if (from != PaymentStatus.PENDING && from != PaymentStatus.BOUNCED && from != PaymentStatus.CANCELLED) {
                    throw illegalTransition(receipt, from, to);
                }
                // a corrected receipt starts its banking trail again
                next.depositBankRef(null).depositDate(null).clearanceDate(null);
                break;
            case DEPOSITED:
                if (from != PaymentStatus.RECEIVED) {
                    throw illegalTransition(receipt, from, to);
                }
                if (!receipt.getPaymentType().requiresDeposit()) {
                    throw new IllegalTransitionException(String.format(
                        "%s payments are not deposited; move %s from RECEIVED to CLEARED directly",
                        receipt.getPaymentType(), receipt.ref()));
                }
                if (isBlank(change.getDepositBankRef())) {
                    throw new ValidationException("Deposit bank is required");
                }
                requireNotBefore("Deposit date", change.getDepositDate(), "receipt date", receipt.getReceiptDate());
                next.depositBankRef(change.getDepositBankRef().trim()).depositDate(change.getDepositDate());
                break;
            case CLEARED: {
                LocalDate earliest;
                String earliestName;
                if (from == PaymentStatus.DEPOSITED) {
                    earliest = receipt.getDepositDate();
                    earliestName = "deposit date";
                } else if (from == PaymentStatus.RECEIVED && !receipt.getPaymentType().requiresDeposit()) {
                    earliest = receipt.getReceiptDate();
                    earliestName = "receipt date";
                } else {
                    throw illegalTransition(receipt, from, to);
                }
                requireNotBefore("Clearance date", change.getClearanceDate(), earliestName, earliest);
                next.clearanceDate(change.getClearanceDate());
                break;
            }
            case BOUNCED:
            case CANCELLED:
                // manual, allowed from any status
                break;
            case PENDING:
                throw illegalTransition(receipt, from, to);
            default:
                throw new IllegalStateException("Unhandled payment status " + to);
        }
        if (!isBlank(change.getNote())) {
            next.notes(change.getNote().trim());
        }
        return next.build();
    }

    /**
     * Stores an allocation proposal on the receipt.
     */
    public Receipt applyAllocations(Receipt receipt, AllocationProposal proposal) {
        approvalGate.requireMutable(receipt.ref(), receipt.getApproval(), "change allocations");
        if (proposal.getNetAmount().compareTo(receipt.getNetAmount()) != 0) {
            throw new ValidationException("Allocation proposal was computed for a different net amount");
        }
        return receipt.toBuilder()
            .allocationMode(proposal.getMode())
            .allocations(proposal.getAllocations())
            .unallocatedAmount(proposal.getUnallocatedAmount())
            .updatedAt(Instant.now())
            .build();
    }

    public void checkCanDelete(Receipt receipt) {
        approvalGate.requireMutable(receipt.ref(), receipt.getApproval(), "delete");
        if (receipt.getPaymentStatus() == PaymentStatus.BOUNCED) {
            throw new IllegalTransitionException(receipt.ref() + " has bounced and is kept for the record");
        }
        if (receipt.isPosted()) {
            throw new IllegalTransitionException(receipt.ref() + " is posted. Reverse the posting before deleting.");
        }
    }

    /**
     * Posting needs approval (or no approval requirement), money in hand and no active voucher.
     */
    public void checkCanPost(Receipt receipt) {
        if (receipt.isPosted()) {
            throw new AlreadyPostedException(receipt.ref());
        }
        if (!receipt.getApproval().allowsPosting()) {
            throw new IllegalTransitionException(String.format(
                "%s cannot be posted while approval is %s", receipt.ref(), receipt.getApproval().getStatus()));
        }
        if (!POSTABLE_STATUSES.contains(receipt.getPaymentStatus())) {
            throw new IllegalTransitionException(String.format(
                "%s cannot be posted in %s payment status. Only RECEIVED or CLEARED receipts can be posted.",
                receipt.ref(), receipt.getPaymentStatus()));
        }
        if (receipt.getNetAmount().signum() <= 0) {
            throw new ValidationException(receipt.ref() + " has nothing to post: net amount is zero");
        }
    }

    public void checkCanReverse(Receipt receipt, boolean hasActivePostings) {
        if (!receipt.isPosted() || !hasActivePostings) {
            throw new NotPostedException(receipt.ref() + " has no active posting to reverse");
        }
    }

    public Receipt markPosted(Receipt receipt, String voucherNo) {
        return receipt.toBuilder().posted(true).postedVoucherNo(voucherNo).updatedAt(Instant.now()).build();
    }

    public Receipt markUnposted(Receipt receipt) {
        return receipt.toBuilder().posted(false).postedVoucherNo(null).updatedAt(Instant.now()).build();
    }

    public Receipt withApproval(Receipt receipt, ApprovalRecord approval) {
        return receipt.toBuilder().approval(approval).updatedAt(Instant.now()).build();
    }

    private Receipt.ReceiptBuilder applyDetails(Receipt.ReceiptBuilder builder, ReceiptDetails details) {
        return builder
            .receiptNo(details.getReceiptNo().trim())
            .customerRef(details.getCustomerRef())
            .receiptDate(details.getReceiptDate())
            .paymentType(details.getPaymentType())
            .chequeNo(details.getChequeNo())
            .notes(details.getNotes())
            .receivedAmount(MoneyRounding.round2(details.getReceivedAmount()))
            .securityDeposit(MoneyRounding.round2(details.getSecurityDeposit()))
            .penalty(MoneyRounding.round2(details.getPenalty()))
            .discount(MoneyRounding.round2(details.getDiscount()));
    }

    private static BigDecimal netAmount(ReceiptDetails details) {
        BigDecimal net = AllocationEngine.netAmount(details.getReceivedAmount(), details.getSecurityDeposit(),
                details.getPenalty(), details.getDiscount());
        if (net.signum() < 0) {
            throw new ValidationException("Receipt net amount must not be negative: " + net);
        }
        return net;
    }

    private static void validate(ReceiptDetails details) {
        if (details == null) {
            throw new ValidationException("Receipt details are required");
        }
        if (isBlank(details.getReceiptNo())) {
            throw new ValidationException("Receipt number is required");
        }
        if (details.getReceiptDate() == null) {
            throw new ValidationException("Receipt date is required");
        }
        if (details.getPaymentType() == null) {
            throw new ValidationException("Payment type is required");
        }
        if (details.getReceivedAmount() == null) {
            throw new ValidationException("Received amount is required");
        }
        if (details.getPaymentType() == PaymentType.CHEQUE && isBlank(details.getChequeNo())) {
            throw new ValidationException("Cheque number is required for cheque payments");
        }
        requireNotNegative("Received amount", details.getReceivedAmount());
        requireNotNegative("Security deposit", details.getSecurityDeposit());
        requireNotNegative("Penalty", details.getPenalty());
        requireNotNegative("Discount", details.getDiscount());
    }

    private static void requireNotNegative(String name, BigDecimal amount) {
        if (MoneyRounding.isNegative(amount)) {
            throw new ValidationException(name + " must not be negative: " + amount);
        }
    }

    private static void requireNotBefore(String name, LocalDate date, String earliestName, LocalDate earliest) {
        if (date == null) {
            throw new ValidationException(name + " is required");
        }
        if (earliest != null && date.isBefore(earliest)) {
            throw new ValidationException(String.format("%s %s is before the %s %s", name, date, earliestName, earliest));
        }
    }

    private static BigDecimal allocatedTotal(List<Allocation> allocations) {
        if (allocations == null) {
            return MoneyRounding.ZERO;
        }
        return MoneyRounding.sum(allocations.stream().map(Allocation::getAmount).toList());
    }

    private static IllegalTransitionException illegalTransition(Receipt receipt, PaymentStatus from, PaymentStatus to) {
        return new IllegalTransitionException(String.format(
            "Cannot move %s from %s to %s", receipt.ref(), from, to));
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
