package com.flagship.lease_ledger.observability;

import com.flagship.lease_ledger.document.BulkResult;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for document operations.
 *
 * Metrics exposed:
 * - lease.document.operations: counter tagged with document type, operation and outcome
 * - lease.operation.latency: timer per operation
 * - lease.ledger.vouchers: vouchers written, tagged posting or reversal
 * - lease.bulk.documents: per-document outcomes of bulk operations
 * - idempotency.cache: receipt creation idempotency hits and misses
 * - lease.ledger.vouchers.unbalanced: gauge, vouchers whose debits and credits differ
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final AtomicLong unbalancedVouchers = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("lease.ledger.vouchers.unbalanced", unbalancedVouchers, AtomicLong::get)
                .description("Vouchers whose debits and credits differ; anything above zero is corruption")
                .register(registry);
    }

    /**
     * @param outcome "success", "rejected" (domain rule refused it) or "error"
     */
    public void recordDocumentOperation(String documentType, String operation, String outcome) {
        registry.counter("lease.document.operations",
                "document_type", sanitizeTag(documentType),
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("lease.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordVoucherWritten(String kind) {
        registry.counter("lease.ledger.vouchers", "kind", sanitizeTag(kind)).increment();
    }

    public void recordBulkResult(String operation, BulkResult result) {
        registry.counter("lease.bulk.documents", "operation", sanitizeTag(operation), "outcome", "applied")
                .increment(result.getApplied());
        registry.counter("lease.bulk.documents", "operation", sanitizeTag(operation), "outcome", "skipped")
                .increment(result.getSkipped());
        registry.counter("lease.bulk.documents", "operation", sanitizeTag(operation), "outcome", "failed")
                .increment(result.getFailed());
    }

    public void updateUnbalancedVouchers(long count) {
        unbalancedVouchers.set(count);
    }

    public long getUnbalancedVouchers() {
        return unbalancedVouchers.get();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Outcome tag for an exception: domain refusals are "rejected", anything else is "error".
     */
    public static String outcomeOf(Exception e) {
        return e instanceof IllegalArgumentException || e instanceof IllegalStateException ? "rejected" : "error";
    }

    /**
     * Keeps tag values short and free of special characters so cardinality stays bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
