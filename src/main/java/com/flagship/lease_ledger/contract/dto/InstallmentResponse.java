package com.flagship.lease_ledger.contract.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.calculation.Installment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class InstallmentResponse {

    @JsonProperty("number")
    int number;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("due_date")
    LocalDate dueDate;

    public static InstallmentResponse from(Installment installment) {
        return new InstallmentResponse(installment.getNumber(), installment.getAmount(), installment.getDueDate());
    }
}
