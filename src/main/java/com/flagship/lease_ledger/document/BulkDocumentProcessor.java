package com.flagship.lease_ledger.document;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs one action per document id, each in its own transaction.
 *
 * A failing id rolls back only its own transaction and is counted as failed; the batch always
 * runs to the end.
 */
@Component
@Slf4j
public class BulkDocumentProcessor {

    private final TransactionTemplate transactionTemplate;

    public BulkDocumentProcessor(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public BulkResult process(String operation, List<UUID> ids, Function<UUID, BulkOutcome> action) {
        int applied = 0;
        int skipped = 0;
        List<UUID> failedIds = new ArrayList<>();

        // duplicate ids are processed once
        for (UUID id : new LinkedHashSet<>(ids)) {
            try {
                BulkOutcome outcome = transactionTemplate.execute(status -> action.apply(id));
                if (outcome == BulkOutcome.APPLIED) {
                    applied++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.warn("Bulk {} failed for document {}: {}", operation, id, e.getMessage());
                failedIds.add(id);
            }
        }

        log.info("Bulk {} finished: applied={}, skipped={}, failed={}",
                operation, applied, skipped, failedIds.size());
        return new BulkResult(applied, skipped, failedIds.size(), List.copyOf(failedIds));
    }
}
