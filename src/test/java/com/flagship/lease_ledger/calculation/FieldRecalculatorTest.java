package com.flagship.lease_ledger.calculation;

import com.flagship.lease_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FieldRecalculatorTest {

    private static final Map<String, BigDecimal> TAX_RATES = Map.of(
        "VAT5", new BigDecimal("5.00"),
        "VAT15", new BigDecimal("15.00")
    );

    private FieldRecalculator recalculator;

    @BeforeEach
    void setUp() {
        TaxRateLookup lookup = taxRateId -> Optional.ofNullable(TAX_RATES.get(taxRateId));
        recalculator = new FieldRecalculator(lookup);
    }

    private LineItem unitTerm(String monthlyRent, Integer installments, String taxRateId) {
        return recalculator.recalculateAll(LineItem.unitTerm(UUID.randomUUID(), "UNIT-101",
                new BigDecimal(monthlyRent), installments, taxRateId,
                LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1)));
    }

    @Test
    @DisplayName("1000 monthly over 12 installments at 5% gives 12000 / 600 / 12600")
    void monthlyRentWithTax() {
        LineItem item = unitTerm("1000", 12, "VAT5");

        assertEquals(new BigDecimal("12000.00"), item.getDerivedAnnualAmount());
        assertEquals(new BigDecimal("5.00"), item.getTaxPercentage());
        assertEquals(new BigDecimal("600.00"), item.getTaxAmount());
        assertEquals(new BigDecimal("12600.00"), item.getTotalAmount());
    }

    @Test
    @DisplayName("No tax rate means zero tax and total equal to the annual amount")
    void noTax() {
        LineItem item = unitTerm("1000", 12, null);

        assertEquals(new BigDecimal("0.00"), item.getTaxPercentage());
        assertEquals(new BigDecimal("0.00"), item.getTaxAmount());
        assertEquals(new BigDecimal("12000.00"), item.getTotalAmount());
    }

    @Test
    @DisplayName("2024-01-01 to 2025-01-01 is 366 days, 12 months, 1 year")
    void durationAcrossLeapYear() {
        LineItem item = unitTerm("1000", 12, null);

        assertEquals(366, item.getDurationDays());
        assertEquals(12, item.getDurationMonths());
        assertEquals(1, item.getDurationYears());
    }

    @Test
    @DisplayName("Missing installment count defaults to 12")
    void defaultMultiplier() {
        LineItem item = unitTerm("500", null, null);

        assertEquals(12, item.getPeriodMultiplier());
        assertEquals(new BigDecimal("6000.00"), item.getDerivedAnnualAmount());
    }

    @Test
    @DisplayName("Changing the base amount flows through annual, tax and total")
    void baseAmountChain() {
        LineItem item = unitTerm("1000", 12, "VAT5");

        LineItem updated = recalculator.recalculate(item, LineItemField.BASE_AMOUNT, "1500");

        assertEquals(new BigDecimal("18000.00"), updated.getDerivedAnnualAmount());
        assertEquals(new BigDecimal("900.00"), updated.getTaxAmount());
        assertEquals(new BigDecimal("18900.00"), updated.getTotalAmount());
        assertEquals(366, updated.getDurationDays());
    }

    @Test
    @DisplayName("Editing the annual amount does not back-propagate to the base amount")
    void annualAmountDoesNotTouchBase() {
        LineItem item = unitTerm("1000", 12, "VAT5");

        LineItem updated = recalculator.recalculate(item, LineItemField.DERIVED_ANNUAL_AMOUNT, new BigDecimal("10000"));

        assertEquals(new BigDecimal("1000.00"), updated.getBaseAmount());
        assertEquals(new BigDecimal("10000.00"), updated.getDerivedAnnualAmount());
        assertEquals(new BigDecimal("500.00"), updated.getTaxAmount());
        assertEquals(new BigDecimal("10500.00"), updated.getTotalAmount());
    }

    @Test
    @DisplayName("Clearing the tax rate forces percentage and amount to zero")
    void clearingTaxRate() {
        LineItem item = unitTerm("1000", 12, "VAT15");
        assertEquals(new BigDecimal("1800.00"), item.getTaxAmount());

        LineItem updated = recalculator.recalculate(item, LineItemField.TAX_RATE, "");

        assertNull(updated.getTaxRateId());
        assertEquals(new BigDecimal("0.00"), updated.getTaxPercentage());
        assertEquals(new BigDecimal("0.00"), updated.getTaxAmount());
        assertEquals(new BigDecimal("12000.00"), updated.getTotalAmount());
    }

    @Test
    @DisplayName("Applying the same edit twice gives the same item")
    void idempotent() {
        LineItem item = unitTerm("1234.56", 4, "VAT5");

        LineItem once = recalculator.recalculate(item, LineItemField.BASE_AMOUNT, "999.99");
        LineItem twice = recalculator.recalculate(once, LineItemField.BASE_AMOUNT, "999.99");

        assertEquals(once, twice);
        assertEquals(recalculator.recalculateAll(once), once);
    }

    @Test
    @DisplayName("To date on or before from date is rejected and the item is unchanged")
    void invalidDateOrder() {
        LineItem item = unitTerm("1000", 12, null);

        assertThrows(ValidationException.class,
                () -> recalculator.recalculate(item, LineItemField.TO_DATE, LocalDate.of(2024, 1, 1)));
        assertEquals(LocalDate.of(2025, 1, 1), item.getToDate());
        assertEquals(366, item.getDurationDays());
    }

    @Test
    @DisplayName("Negative amounts, a zero multiplier and unknown tax rates are rejected")
    void invalidValues() {
        LineItem item = unitTerm("1000", 12, null);

        assertThrows(ValidationException.class,
                () -> recalculator.recalculate(item, LineItemField.BASE_AMOUNT, "-1"));
        assertThrows(ValidationException.class,
                () -> recalculator.recalculate(item, LineItemField.PERIOD_MULTIPLIER, 0));
        assertThrows(ValidationException.class,
                () -> recalculator.recalculate(item, LineItemField.TAX_RATE, "GST99"));
        assertThrows(ValidationException.class,
                () -> recalculator.recalculate(item, LineItemField.BASE_AMOUNT, "abc"));
    }

    @Test
    @DisplayName("Fields that do not apply to the item kind are rejected")
    void fieldKindMismatch() {
        LineItem charge = recalculator.recalculateAll(
                LineItem.charge(UUID.randomUUID(), "MAINT", new BigDecimal("250"), "VAT5"));

        assertThrows(ValidationException.class,
                () -> recalculator.recalculate(charge, LineItemField.FROM_DATE, LocalDate.of(2024, 1, 1)));
        assertThrows(ValidationException.class,
                () -> recalculator.recalculate(unitTerm("1000", 12, null), LineItemField.AMOUNT, "10"));
    }

    @Test
    @DisplayName("Charge amount edits run the tax and total chain")
    void chargeAmount() {
        LineItem charge = recalculator.recalculateAll(
                LineItem.charge(UUID.randomUUID(), "MAINT", new BigDecimal("250"), "VAT5"));
        assertEquals(new BigDecimal("262.50"), charge.getTotalAmount());

        LineItem updated = recalculator.recalculate(charge, LineItemField.AMOUNT, "300");

        assertEquals(new BigDecimal("300.00"), updated.getDerivedAnnualAmount());
        assertEquals(new BigDecimal("15.00"), updated.getTaxAmount());
        assertEquals(new BigDecimal("315.00"), updated.getTotalAmount());
    }
}
