package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.receipt.PaymentStatus;
import com.flagship.lease_ledger.receipt.PaymentStatusChange;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class PaymentStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("deposit_bank_ref")
    String depositBankRef;

    @JsonProperty("deposit_date")
    LocalDate depositDate;

    @JsonProperty("clearance_date")
    LocalDate clearanceDate;

    @JsonProperty("note")
    String note;

    public PaymentStatusChange toChange() {
        return new PaymentStatusChange(status, depositBankRef, depositDate, clearanceDate, note);
    }
}
