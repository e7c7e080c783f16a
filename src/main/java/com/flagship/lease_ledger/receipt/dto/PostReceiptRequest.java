package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.receipt.PostingInstruction;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.time.LocalDate;

@Value
public class PostReceiptRequest {

    @NotBlank(message = "Debit account is required")
    @JsonProperty("debit_account_ref")
    String debitAccountRef;

    @NotBlank(message = "Credit account is required")
    @JsonProperty("credit_account_ref")
    String creditAccountRef;

    @JsonProperty("posting_date")
    LocalDate postingDate;

    @JsonProperty("narration")
    String narration;

    public PostingInstruction toInstruction() {
        return new PostingInstruction(debitAccountRef, creditAccountRef, postingDate, narration);
    }
}
