package com.flagship.lease_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.calculation.LineItemKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LineItemResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    LineItemKind kind;

    @JsonProperty("item_ref")
    String itemRef;

    @JsonProperty("base_amount")
    BigDecimal baseAmount;

    @JsonProperty("period_multiplier")
    Integer periodMultiplier;

    @JsonProperty("derived_annual_amount")
    BigDecimal derivedAnnualAmount;

    @JsonProperty("tax_rate_id")
    String taxRateId;

    @JsonProperty("tax_percentage")
    BigDecimal taxPercentage;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("from_date")
    LocalDate fromDate;

    @JsonProperty("to_date")
    LocalDate toDate;

    @JsonProperty("duration_days")
    Integer durationDays;

    @JsonProperty("duration_months")
    Integer durationMonths;

    @JsonProperty("duration_years")
    Integer durationYears;

    public static LineItemResponse from(LineItem item) {
        return LineItemResponse.builder()
            .id(item.getId())
            .kind(item.getKind())
            .itemRef(item.getItemRef())
            .baseAmount(item.getBaseAmount())
            .periodMultiplier(item.getPeriodMultiplier())
            .derivedAnnualAmount(item.getDerivedAnnualAmount())
            .taxRateId(item.getTaxRateId())
            .taxPercentage(item.getTaxPercentage())
            .taxAmount(item.getTaxAmount())
            .totalAmount(item.getTotalAmount())
            .fromDate(item.getFromDate())
            .toDate(item.getToDate())
            .durationDays(item.getDurationDays())
            .durationMonths(item.getDurationMonths())
            .durationYears(item.getDurationYears())
            .build();
    }
}
