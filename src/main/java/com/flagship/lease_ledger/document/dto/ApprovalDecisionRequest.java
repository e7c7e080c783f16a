package com.flagship.lease_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Optional body of approve and reject calls.
 */
@Value
public class ApprovalDecisionRequest {

    @JsonProperty("comment")
    String comment;

    @JsonProperty("reason")
    String reason;
}
