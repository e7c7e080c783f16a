package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.receipt.PostingInstruction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Same accounts for every receipt; each receipt posts its own net amount on its receipt date
 * unless a posting date is given.
 */
@Value
public class BulkPostRequest {

    @NotEmpty(message = "At least one id is required")
    @JsonProperty("ids")
    List<UUID> ids;

    @NotBlank(message = "Debit account is required")
    @JsonProperty("debit_account_ref")
    String debitAccountRef;

    @NotBlank(message = "Credit account is required")
    @JsonProperty("credit_account_ref")
    String creditAccountRef;

    @JsonProperty("posting_date")
    LocalDate postingDate;

    public PostingInstruction toInstruction() {
        return new PostingInstruction(debitAccountRef, creditAccountRef, postingDate, null);
    }
}
