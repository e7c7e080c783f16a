package com.flagship.lease_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.document.BulkResult;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class BulkResultResponse {

    @JsonProperty("applied")
    int applied;

    @JsonProperty("skipped")
    int skipped;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("failed_ids")
    List<UUID> failedIds;

    public static BulkResultResponse from(BulkResult result) {
        return new BulkResultResponse(result.getApplied(), result.getSkipped(), result.getFailed(), result.getFailedIds());
    }
}
