package com.flagship.lease_ledger.document;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Aggregate counts of a bulk operation. Failed ids are listed so the caller can retry them.
 */
@Value
public class BulkResult {
    int applied;
    int skipped;
    int failed;
    List<UUID> failedIds;
}
