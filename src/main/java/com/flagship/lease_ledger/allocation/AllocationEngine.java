package com.flagship.lease_ledger.allocation;

import com.flagship.lease_ledger.calculation.MoneyRounding;
import com.flagship.lease_ledger.exception.OverAllocationException;
import com.flagship.lease_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Proposes how a receipt's net amount is spread over invoices.
 *
 * The engine only reads invoice balances and never changes them. A proposal that fails
 * validation is rejected as a whole; no partial allocation is ever returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllocationEngine {

    private final InvoiceBalanceLookup invoiceBalanceLookup;

    /**
     * round2(received + securityDeposit + penalty - discount). Null components count as zero.
     */
    public static BigDecimal netAmount(BigDecimal received, BigDecimal securityDeposit,
                                       BigDecimal penalty, BigDecimal discount) {
        return MoneyRounding.round2(zeroIfNull(received)
            .add(zeroIfNull(securityDeposit))
            .add(zeroIfNull(penalty))
            .subtract(zeroIfNull(discount)));
    }

    /**
     * @param netAmount the receipt's net amount
     * @param mode allocation mode
     * @param entries requested allocations; amounts are only read in MULTIPLE mode
     * @throws ValidationException on a negative net amount or malformed entries
     * @throws OverAllocationException when MULTIPLE amounts add up to more than the net amount
     */
    public AllocationProposal propose(BigDecimal netAmount, AllocationMode mode, List<Allocation> entries) {
        Objects.requireNonNull(mode, "mode");
        if (netAmount == null || netAmount.signum() < 0) {
            throw new ValidationException("Receipt net amount must not be negative: " + netAmount);
        }
        BigDecimal net = MoneyRounding.round2(netAmount);
        List<Allocation> requested = entries != null ? entries : List.of();
        requireDistinctInvoices(requested);

        List<Allocation> allocations;
        switch (mode) {
            case SINGLE:
                allocations = single(net, requested);
                break;
            case MULTIPLE:
                allocations = multiple(net, requested);
                break;
            case PROPORTIONAL:
                allocations = proportional(net, requested);
                break;
            default:
                throw new IllegalStateException("Unhandled allocation mode " + mode);
        }

        BigDecimal allocated = MoneyRounding.sum(allocations.stream().map(Allocation::getAmount).toList());
        BigDecimal unallocated = MoneyRounding.round2(net.subtract(allocated).max(BigDecimal.ZERO));

        log.debug("Allocation proposal: mode={}, net={}, allocated={}, unallocated={}",
                mode, net, allocated, unallocated);
        return new AllocationProposal(mode, net, List.copyOf(allocations), allocated, unallocated);
    }

    private List<Allocation> single(BigDecimal net, List<Allocation> requested) {
        if (requested.size() != 1) {
            throw new ValidationException("Single allocation needs exactly one invoice, got " + requested.size());
        }
        Allocation entry = requested.get(0);
        BigDecimal outstanding = outstandingBalance(entry.getInvoiceRef());
        BigDecimal amount = MoneyRounding.round2(net.min(outstanding));
        if (amount.signum() == 0) {
            return List.of();
        }
        return List.of(entry.withAmount(amount));
    }

    private List<Allocation> multiple(BigDecimal net, List<Allocation> requested) {
        List<Allocation> allocations = new ArrayList<>(requested.size());
        BigDecimal total = BigDecimal.ZERO;
        for (Allocation entry : requested) {
            if (entry.getAmount() == null || entry.getAmount().signum() <= 0) {
                throw new ValidationException(String.format(
                    "Allocation amount for invoice %s must be positive", entry.getInvoiceRef()));
            }
            BigDecimal amount = MoneyRounding.round2(entry.getAmount());
            allocations.add(entry.withAmount(amount));
            total = total.add(amount);
        }
        if (total.compareTo(net) > 0) {
            throw new OverAllocationException(net, MoneyRounding.round2(total));
        }
        return allocations;
    }

    private List<Allocation> proportional(BigDecimal net, List<Allocation> requested) {
        if (requested.isEmpty()) {
            throw new ValidationException("Proportional allocation needs at least one invoice");
        }

        Map<Allocation, BigDecimal> balances = new LinkedHashMap<>();
        BigDecimal totalOutstanding = BigDecimal.ZERO;
        for (Allocation entry : requested) {
            BigDecimal outstanding = outstandingBalance(entry.getInvoiceRef());
            if (outstanding.signum() > 0) {
                balances.put(entry, outstanding);
                totalOutstanding = totalOutstanding.add(outstanding);
            }
        }
        if (balances.isEmpty()) {
            return List.of();
        }

        BigDecimal toSpread = MoneyRounding.round2(net.min(totalOutstanding));
        List<Allocation> allocations = new ArrayList<>(balances.size());
        BigDecimal spread = BigDecimal.ZERO;
        int remaining = balances.size();
        for (Map.Entry<Allocation, BigDecimal> balance : balances.entrySet()) {
            remaining--;
            BigDecimal amount;
            if (remaining == 0) {
                // last invoice takes the rounding remainder
                amount = toSpread.subtract(spread);
            } else {
                amount = MoneyRounding.round2(toSpread.multiply(balance.getValue())
                    .divide(totalOutstanding, 10, RoundingMode.HALF_UP));
            }
            spread = spread.add(amount);
            if (amount.signum() > 0) {
                allocations.add(balance.getKey().withAmount(MoneyRounding.round2(amount)));
            }
        }
        return allocations;
    }

    private BigDecimal outstandingBalance(String invoiceRef) {
        return invoiceBalanceLookup.getOutstandingBalance(invoiceRef)
            .map(balance -> balance.max(BigDecimal.ZERO))
            .orElseThrow(() -> new ValidationException("Unknown invoice: " + invoiceRef));
    }

    private static void requireDistinctInvoices(List<Allocation> entries) {
        Set<String> seen = new HashSet<>();
        for (Allocation entry : entries) {
            if (entry.getInvoiceRef() == null || entry.getInvoiceRef().isBlank()) {
                throw new ValidationException("Allocation invoice reference is required");
            }
            if (!seen.add(entry.getInvoiceRef())) {
                throw new ValidationException("Invoice allocated more than once: " + entry.getInvoiceRef());
            }
        }
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
