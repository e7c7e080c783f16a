package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.time.LocalDate;

@Value
public class ReversalRequest {

    @NotBlank(message = "Reversal reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("reversal_date")
    LocalDate reversalDate;
}
