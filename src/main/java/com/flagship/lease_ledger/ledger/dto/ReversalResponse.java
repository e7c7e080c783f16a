package com.flagship.lease_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.ledger.ReversalResult;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class ReversalResponse {

    @JsonProperty("reversed_voucher_no")
    String reversedVoucherNo;

    @JsonProperty("reversal_voucher_no")
    String reversalVoucherNo;

    @JsonProperty("document_id")
    UUID documentId;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("postings")
    List<PostingResponse> postings;

    public static ReversalResponse from(ReversalResult result) {
        return new ReversalResponse(result.getReversedVoucherNo(), result.getReversalVoucherNo(),
                result.getDocument().getId(), result.getReason(),
                result.getReversalPostings().stream().map(PostingResponse::from).toList());
    }
}
