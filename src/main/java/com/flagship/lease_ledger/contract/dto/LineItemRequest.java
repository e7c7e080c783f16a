package com.flagship.lease_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.calculation.LineItem;
import com.flagship.lease_ledger.calculation.LineItemKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A new unit-term or charge row. For charges base_amount is the flat charge amount and the
 * period and date fields are ignored.
 */
@Value
public class LineItemRequest {

    @NotNull(message = "Line item kind is required")
    @JsonProperty("kind")
    LineItemKind kind;

    @NotBlank(message = "Item reference is required")
    @JsonProperty("item_ref")
    String itemRef;

    @NotNull(message = "Base amount is required")
    @DecimalMin(value = "0.00", message = "Base amount must not be negative")
    @JsonProperty("base_amount")
    BigDecimal baseAmount;

    @Positive(message = "Period multiplier must be positive")
    @JsonProperty("period_multiplier")
    Integer periodMultiplier;

    @JsonProperty("tax_rate_id")
    String taxRateId;

    @JsonProperty("from_date")
    LocalDate fromDate;

    @JsonProperty("to_date")
    LocalDate toDate;

    public LineItem toDomain() {
        if (kind == LineItemKind.CHARGE) {
            return LineItem.charge(null, itemRef, baseAmount, taxRateId);
        }
        return LineItem.unitTerm(null, itemRef, baseAmount, periodMultiplier, taxRateId, fromDate, toDate);
    }
}
