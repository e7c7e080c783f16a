package com.flagship.lease_ledger.calculation;

import com.flagship.lease_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the derived fields of a {@link LineItem} consistent when one raw field changes.
 *
 * The dependency graph is static and acyclic: each editable field maps to an ordered list of
 * derived fields, and derived fields never feed back into raw ones. An edit is applied to a copy
 * of the item and the whole chain is evaluated on that copy, so a validation error leaves the
 * caller's item untouched.
 *
 * Chains:
 * <pre>
 * BASE_AMOUNT, PERIOD_MULTIPLIER -> ANNUAL_AMOUNT -> TAX_AMOUNT -> TOTAL_AMOUNT
 * DERIVED_ANNUAL_AMOUNT, AMOUNT  -> TAX_AMOUNT -> TOTAL_AMOUNT
 * TAX_RATE                       -> TAX_PERCENTAGE -> TAX_AMOUNT -> TOTAL_AMOUNT
 * FROM_DATE, TO_DATE             -> DURATION
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FieldRecalculator {

    /**
     * Installments per year when none is given.
     */
    public static final int DEFAULT_PERIOD_MULTIPLIER = 12;

    enum DerivedField {
        ANNUAL_AMOUNT,
        TAX_PERCENTAGE,
        TAX_AMOUNT,
        TOTAL_AMOUNT,
        DURATION
    }

    private static final Map<LineItemField, List<DerivedField>> DEPENDENCIES = buildDependencies();

    private static final List<DerivedField> FULL_UNIT_TERM_CHAIN = List.of(
        DerivedField.ANNUAL_AMOUNT, DerivedField.TAX_PERCENTAGE, DerivedField.TAX_AMOUNT,
        DerivedField.TOTAL_AMOUNT, DerivedField.DURATION);

    private static final List<DerivedField> FULL_CHARGE_CHAIN = List.of(
        DerivedField.TAX_PERCENTAGE, DerivedField.TAX_AMOUNT, DerivedField.TOTAL_AMOUNT);

    private final TaxRateLookup taxRateLookup;

    private static Map<LineItemField, List<DerivedField>> buildDependencies() {
        Map<LineItemField, List<DerivedField>> graph = new EnumMap<>(LineItemField.class);
        List<DerivedField> amountChain = List.of(
            DerivedField.ANNUAL_AMOUNT, DerivedField.TAX_AMOUNT, DerivedField.TOTAL_AMOUNT);
        List<DerivedField> taxChain = List.of(DerivedField.TAX_AMOUNT, DerivedField.TOTAL_AMOUNT);

        graph.put(LineItemField.BASE_AMOUNT, amountChain);
        graph.put(LineItemField.PERIOD_MULTIPLIER, amountChain);
        graph.put(LineItemField.DERIVED_ANNUAL_AMOUNT, taxChain);
        graph.put(LineItemField.AMOUNT, taxChain);
        graph.put(LineItemField.TAX_RATE, List.of(
            DerivedField.TAX_PERCENTAGE, DerivedField.TAX_AMOUNT, DerivedField.TOTAL_AMOUNT));
        graph.put(LineItemField.FROM_DATE, List.of(DerivedField.DURATION));
        graph.put(LineItemField.TO_DATE, List.of(DerivedField.DURATION));
        return Collections.unmodifiableMap(graph);
    }

    /**
     * Applies one field edit and recomputes every field downstream of it.
     *
     * @param item current line item
     * @param field the field the user changed
     * @param newValue typed value or its text form; see {@link LineItemField#coerce}
     * @return a new, consistent line item
     * @throws ValidationException if the value is invalid for the field or the item kind
     */
    public LineItem recalculate(LineItem item, LineItemField field, Object newValue) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(field, "field");
        if (!field.appliesTo(item.getKind())) {
            throw new ValidationException(String.format("%s cannot be edited on a %s line item", field, item.getKind()));
        }

        LineItem result = applyEdit(item, field, field.coerce(newValue));
        for (DerivedField derived : DEPENDENCIES.get(field)) {
            result = derive(result, derived);
        }

        log.debug("Recalculated line item {} after {} change: annual={}, tax={}, total={}",
                item.getId(), field, result.getDerivedAnnualAmount(), result.getTaxAmount(), result.getTotalAmount());
        return result;
    }

    /**
     * Builds a fully consistent line item from its raw inputs. Used when a row is first added.
     */
    public LineItem recalculateAll(LineItem item) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(item.getKind(), "kind");

        LineItem result;
        List<DerivedField> chain;
        if (item.isUnitTerm()) {
            requireNonNegative(LineItemField.BASE_AMOUNT, item.getBaseAmount());
            requirePositiveMultiplier(item.getPeriodMultiplier());
            if (item.getFromDate() != null && item.getToDate() != null) {
                requireDateOrder(item.getFromDate(), item.getToDate());
            }
            result = item.toBuilder().baseAmount(MoneyRounding.round2(item.getBaseAmount())).build();
            chain = FULL_UNIT_TERM_CHAIN;
        } else {
            result = applyEdit(item, LineItemField.AMOUNT, item.getBaseAmount());
            chain = FULL_CHARGE_CHAIN;
        }

        for (DerivedField derived : chain) {
            result = derive(result, derived);
        }
        return result;
    }

    private LineItem applyEdit(LineItem item, LineItemField field, Object value) {
        switch (field) {
            case BASE_AMOUNT: {
                BigDecimal amount = (BigDecimal) value;
                requireNonNegative(field, amount);
                return item.toBuilder().baseAmount(MoneyRounding.round2(amount)).build();
            }
            case PERIOD_MULTIPLIER: {
                Integer multiplier = (Integer) value;
                requirePositiveMultiplier(multiplier);
                return item.toBuilder().periodMultiplier(multiplier).build();
            }
            case DERIVED_ANNUAL_AMOUNT: {
                BigDecimal amount = (BigDecimal) value;
                requireNonNegative(field, amount);
                return item.toBuilder().derivedAnnualAmount(MoneyRounding.round2(amount)).build();
            }
            case AMOUNT: {
                BigDecimal amount = (BigDecimal) value;
                requireNonNegative(field, amount);
                BigDecimal rounded = MoneyRounding.round2(amount);
                return item.toBuilder()
                    .baseAmount(rounded)
                    .periodMultiplier(1)
                    .derivedAnnualAmount(rounded)
                    .build();
            }
            case TAX_RATE:
                return item.toBuilder().taxRateId((String) value).build();
            case FROM_DATE: {
                LocalDate from = (LocalDate) value;
                if (item.getToDate() != null) {
                    requireDateOrder(from, item.getToDate());
                }
                return item.toBuilder().fromDate(from).build();
            }
            case TO_DATE: {
                LocalDate to = (LocalDate) value;
                if (item.getFromDate() != null) {
                    requireDateOrder(item.getFromDate(), to);
                }
                return item.toBuilder().toDate(to).build();
            }
            default:
                throw new IllegalStateException("Unhandled field " + field);
        }
    }

    private LineItem derive(LineItem item, DerivedField derived) {
        switch (derived) {
            case ANNUAL_AMOUNT: {
                int multiplier = item.getPeriodMultiplier() != null
                    ? item.getPeriodMultiplier()
                    : DEFAULT_PERIOD_MULTIPLIER;
                BigDecimal base = item.getBaseAmount() != null ? item.getBaseAmount() : BigDecimal.ZERO;
                return item.toBuilder()
                    .periodMultiplier(multiplier)
                    .derivedAnnualAmount(MoneyRounding.round2(base.multiply(BigDecimal.valueOf(multiplier))))
                    .build();
            }
            case TAX_PERCENTAGE: {
                if (!item.hasTax()) {
                    return item.toBuilder().taxPercentage(MoneyRounding.ZERO).build();
                }
                BigDecimal percentage = taxRateLookup.getTaxRate(item.getTaxRateId())
                    .orElseThrow(() -> new ValidationException("Unknown tax rate: " + item.getTaxRateId()));
                return item.toBuilder().taxPercentage(percentage).build();
            }
            case TAX_AMOUNT: {
                // no tax rate selected: nothing cached may survive
                if (!item.hasTax() || item.getTaxPercentage() == null) {
                    return item.toBuilder()
                        .taxPercentage(item.hasTax() ? item.getTaxPercentage() : MoneyRounding.ZERO)
                        .taxAmount(MoneyRounding.ZERO)
                        .build();
                }
                BigDecimal annual = MoneyRounding.round2(item.getDerivedAnnualAmount());
                return item.toBuilder()
                    .taxAmount(MoneyRounding.percentOf(annual, item.getTaxPercentage()))
                    .build();
            }
            case TOTAL_AMOUNT: {
                BigDecimal annual = MoneyRounding.round2(item.getDerivedAnnualAmount());
                BigDecimal tax = MoneyRounding.round2(item.getTaxAmount());
                return item.toBuilder().totalAmount(MoneyRounding.round2(annual.add(tax))).build();
            }
            case DURATION: {
                LocalDate from = item.getFromDate();
                LocalDate to = item.getToDate();
                if (from == null || to == null) {
                    return item;
                }
                return item.toBuilder()
                    .durationDays((int) ChronoUnit.DAYS.between(from, to))
                    .durationMonths((int) ChronoUnit.MONTHS.between(from, to))
                    .durationYears((int) ChronoUnit.YEARS.between(from, to))
                    .build();
            }
            default:
                throw new IllegalStateException("Unhandled derived field " + derived);
        }
    }

    private static void requireNonNegative(LineItemField field, BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException(field + " is required");
        }
        if (amount.signum() < 0) {
            throw new ValidationException(String.format("%s must not be negative: %s", field, amount));
        }
    }

    private static void requirePositiveMultiplier(Integer multiplier) {
        if (multiplier != null && multiplier <= 0) {
            throw new ValidationException("PERIOD_MULTIPLIER must be positive: " + multiplier);
        }
    }

    private static void requireDateOrder(LocalDate from, LocalDate to) {
        if (!to.isAfter(from)) {
            throw new ValidationException(String.format("To date %s must be after from date %s", to, from));
        }
    }
}
