package com.flagship.lease_ledger.calculation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A contract unit-term or additional charge with its derived money and duration fields.
 *
 * Instances are immutable. {@link FieldRecalculator} returns a new instance for every edit, so
 * a rejected edit can never leave a half-updated row behind.
 *
 * Invariants after every recalculation:
 * - totalAmount = round2(derivedAnnualAmount + taxAmount)
 * - taxAmount = round2(derivedAnnualAmount * taxPercentage / 100) when a tax rate is selected
 * - taxPercentage = taxAmount = 0 when taxRateId is null
 */
@Value
@Builder(toBuilder = true)
public class LineItem {
    UUID id;
    LineItemKind kind;

    /**
     * Unit reference for unit-terms, charge reference for charges.
     */
    String itemRef;

    BigDecimal baseAmount;
    Integer periodMultiplier;
    BigDecimal derivedAnnualAmount;

    /**
     * Null means no tax.
     */
    String taxRateId;
    BigDecimal taxPercentage;
    BigDecimal taxAmount;
    BigDecimal totalAmount;

    LocalDate fromDate;
    LocalDate toDate;
    Integer durationDays;
    Integer durationMonths;
    Integer durationYears;

    /**
     * Raw unit-term row as entered; run it through {@link FieldRecalculator#recalculateAll}
     * before use.
     */
    public static LineItem unitTerm(UUID id, String unitRef, BigDecimal monthlyRent, Integer installments,
                                    String taxRateId, LocalDate fromDate, LocalDate toDate) {
        return LineItem.builder()
            .id(id)
            .kind(LineItemKind.UNIT_TERM)
            .itemRef(unitRef)
            .baseAmount(monthlyRent)
            .periodMultiplier(installments)
            .taxRateId(taxRateId)
            .fromDate(fromDate)
            .toDate(toDate)
            .build();
    }

    /**
     * Raw charge row as entered; run it through {@link FieldRecalculator#recalculateAll}
     * before use.
     */
    public static LineItem charge(UUID id, String chargeRef, BigDecimal amount, String taxRateId) {
        return LineItem.builder()
            .id(id)
            .kind(LineItemKind.CHARGE)
            .itemRef(chargeRef)
            .baseAmount(amount)
            .periodMultiplier(1)
            .taxRateId(taxRateId)
            .build();
    }

    public boolean hasTax() {
        return taxRateId != null;
    }

    public boolean isUnitTerm() {
        return kind == LineItemKind.UNIT_TERM;
    }
}
