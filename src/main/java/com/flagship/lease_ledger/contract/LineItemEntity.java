package com.flagship.lease_ledger.contract;

import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.calculation.LineItemKind;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A row of {@code contract_line_items}. Updated in place by id so a recalculated item keeps its
 * identity.
 */
@Entity
@Table(name = "contract_line_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LineItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private LineItemKind kind;

    @Column(name = "item_ref", nullable = false, length = 64)
    private String itemRef;

    @Column(name = "base_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal baseAmount;

    @Column(name = "period_multiplier")
    private Integer periodMultiplier;

    @Column(name = "derived_annual_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal derivedAnnualAmount;

    @Column(name = "tax_rate_id", length = 32)
    private String taxRateId;

    @Column(name = "tax_percentage", nullable = false, precision = 7, scale = 2)
    private BigDecimal taxPercentage;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "from_date")
    private LocalDate fromDate;

    @Column(name = "to_date")
    private LocalDate toDate;

    @Column(name = "duration_days")
    private Integer durationDays;

    @Column(name = "duration_months")
    private Integer durationMonths;

    @Column(name = "duration_years")
    private Integer durationYears;

    static LineItemEntity fromDomain(LineItem item) {
        LineItemEntity entity = new LineItemEntity();
        entity.id = item.getId();
        entity.updateFromDomain(item);
        return entity;
    }

    LineItem toDomain() {
        return LineItem.builder()
            .id(id)
            .kind(kind)
            .itemRef(itemRef)
            .baseAmount(baseAmount)
            .periodMultiplier(periodMultiplier)
            .derivedAnnualAmount(derivedAnnualAmount)
            .taxRateId(taxRateId)
            .taxPercentage(taxPercentage)
            .taxAmount(taxAmount)
            .totalAmount(totalAmount)
            .fromDate(fromDate)
            .toDate(toDate)
            .durationDays(durationDays)
            .durationMonths(durationMonths)
            .durationYears(durationYears)
            .build();
    }

    void updateFromDomain(LineItem item) {
        this.kind = item.getKind();
        this.itemRef = item.getItemRef();
        this.baseAmount = item.getBaseAmount();
        this.periodMultiplier = item.getPeriodMultiplier();
        this.derivedAnnualAmount = item.getDerivedAnnualAmount();
        this.taxRateId = item.getTaxRateId();
        this.taxPercentage = item.getTaxPercentage();
        this.taxAmount = item.getTaxAmount();
        this.totalAmount = item.getTotalAmount();
        this.fromDate = item.getFromDate();
        this.toDate = item.getToDate();
        this.durationDays = item.getDurationDays();
        this.durationMonths = item.getDurationMonths();
        this.durationYears = item.getDurationYears();
    }
}
