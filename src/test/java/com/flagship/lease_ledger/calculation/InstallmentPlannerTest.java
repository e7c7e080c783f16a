package com.flagship.lease_ledger.calculation;

import com.flagship.lease_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstallmentPlannerTest {

    private final InstallmentPlanner planner = new InstallmentPlanner();

    @Test
    @DisplayName("Last installment absorbs the rounding remainder")
    void remainderOnLast() {
        List<Installment> plan = planner.plan(new BigDecimal("100.00"), 3, LocalDate.of(2024, 1, 1));

        assertEquals(3, plan.size());
        assertEquals(new BigDecimal("33.33"), plan.get(0).getAmount());
        assertEquals(new BigDecimal("33.33"), plan.get(1).getAmount());
        assertEquals(new BigDecimal("33.34"), plan.get(2).getAmount());
    }

    @Test
    @DisplayName("Quarterly installments are three months apart")
    void quarterlyDueDates() {
        List<Installment> plan = planner.plan(new BigDecimal("12600.00"), 4, LocalDate.of(2024, 1, 1));

        assertEquals(LocalDate.of(2024, 1, 1), plan.get(0).getDueDate());
        assertEquals(LocalDate.of(2024, 4, 1), plan.get(1).getDueDate());
        assertEquals(LocalDate.of(2024, 10, 1), plan.get(3).getDueDate());
        assertEquals(new BigDecimal("3150.00"), plan.get(3).getAmount());
    }

    @Test
    @DisplayName("Counts that do not divide a year fall back to monthly spacing")
    void monthlyFallback() {
        List<Installment> plan = planner.plan(new BigDecimal("500.00"), 5, LocalDate.of(2024, 1, 31));

        assertEquals(LocalDate.of(2024, 2, 29), plan.get(1).getDueDate());
        BigDecimal total = plan.stream().map(Installment::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(new BigDecimal("500.00"), total);
    }

    @Test
    @DisplayName("Non-positive counts are rejected")
    void invalidCount() {
        assertThrows(ValidationException.class, () -> planner.plan(new BigDecimal("100"), 0, null));
    }
}
