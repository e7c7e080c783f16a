package com.flagship.lease_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.calculation.LineItemField;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * One edited field. value may be a number, a string, or null (clears TAX_RATE, defaults
 * PERIOD_MULTIPLIER).
 */
@Value
public class FieldChangeRequest {

    @NotNull(message = "Field is required")
    @JsonProperty("field")
    LineItemField field;

    @JsonProperty("value")
    Object value;
}
