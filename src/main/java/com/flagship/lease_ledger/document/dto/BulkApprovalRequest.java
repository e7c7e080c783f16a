package com.flagship.lease_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.approval.ApprovalAction;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class BulkApprovalRequest {

    @NotEmpty(message = "At least one id is required")
    @JsonProperty("ids")
    List<UUID> ids;

    @NotNull(message = "Action is required")
    @JsonProperty("action")
    ApprovalAction action;

    /**
     * Comment for APPROVE, mandatory reason for REJECT.
     */
    @JsonProperty("text")
    String text;
}
