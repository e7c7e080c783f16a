package com.flagship.lease_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.ledger.Posting;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PostingResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("voucher_no")
    String voucherNo;

    @JsonProperty("line_no")
    int lineNo;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("account_ref")
    String accountRef;

    @JsonProperty("debit_amount")
    BigDecimal debitAmount;

    @JsonProperty("credit_amount")
    BigDecimal creditAmount;

    @JsonProperty("document_type")
    String documentType;

    @JsonProperty("document_id")
    UUID documentId;

    @JsonProperty("narration")
    String narration;

    @JsonProperty("is_reversed")
    boolean reversed;

    @JsonProperty("reversal_reason")
    String reversalReason;

    @JsonProperty("reversed_by_voucher_no")
    String reversedByVoucherNo;

    public static PostingResponse from(Posting posting) {
        return PostingResponse.builder()
            .id(posting.getId())
            .voucherNo(posting.getVoucherNo())
            .lineNo(posting.getLineNo())
            .date(posting.getPostingDate())
            .accountRef(posting.getAccountRef())
            .debitAmount(posting.getDebitAmount())
            .creditAmount(posting.getCreditAmount())
            .documentType(posting.getDocument().getType().name())
            .documentId(posting.getDocument().getId())
            .narration(posting.getNarration())
            .reversed(posting.isReversed())
            .reversalReason(posting.getReversalReason())
            .reversedByVoucherNo(posting.getReversedByVoucherNo())
            .build();
    }
}
