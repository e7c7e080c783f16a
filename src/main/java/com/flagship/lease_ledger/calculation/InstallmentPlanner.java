package com.flagship.lease_ledger.calculation;

import com.flagship.lease_ledger.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line total into a payment schedule.
 *
 * Every installment but the last is round2(total / count); the last absorbs the rounding
 * remainder so the schedule always sums to the total exactly. Due dates are spaced 12 / count
 * months apart (monthly, quarterly, half-yearly, yearly); counts that do not divide a year fall
 * back to monthly spacing.
 */
@Component
public class InstallmentPlanner {

    public List<Installment> plan(BigDecimal total, int count, LocalDate firstDueDate) {
        if (total == null || total.signum() < 0) {
            throw new ValidationException("Installment total must be zero or positive");
        }
        if (count <= 0) {
            throw new ValidationException("Installment count must be positive: " + count);
        }

        BigDecimal roundedTotal = MoneyRounding.round2(total);
        BigDecimal share = roundedTotal.divide(BigDecimal.valueOf(count), MoneyRounding.SCALE, RoundingMode.HALF_UP);
        int monthsApart = 12 % count == 0 ? 12 / count : 1;

        List<Installment> installments = new ArrayList<>(count);
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 1; i <= count; i++) {
            BigDecimal amount = i < count ? share : roundedTotal.subtract(allocated);
            LocalDate dueDate = firstDueDate != null ? firstDueDate.plusMonths((long) (i - 1) * monthsApart) : null;
            installments.add(new Installment(i, MoneyRounding.round2(amount), dueDate));
            allocated = allocated.add(amount);
        }
        return installments;
    }

    /**
     * Schedule for a unit-term, one installment per period starting at its from date.
     */
    public List<Installment> plan(LineItem item) {
        int count = item.getPeriodMultiplier() != null
            ? item.getPeriodMultiplier()
            : FieldRecalculator.DEFAULT_PERIOD_MULTIPLIER;
        return plan(item.getTotalAmount(), count, item.getFromDate());
    }
}
