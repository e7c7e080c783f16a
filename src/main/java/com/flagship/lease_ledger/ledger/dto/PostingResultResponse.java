package com.flagship.lease_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.ledger.PostingResult;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class PostingResultResponse {

    @JsonProperty("voucher_no")
    String voucherNo;

    @JsonProperty("document_id")
    UUID documentId;

    @JsonProperty("postings")
    List<PostingResponse> postings;

    public static PostingResultResponse from(PostingResult result) {
        return new PostingResultResponse(result.getVoucherNo(), result.getDocument().getId(),
                result.getPostings().stream().map(PostingResponse::from).toList());
    }
}
