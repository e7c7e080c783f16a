package com.flagship.lease_ledger.observability;

import com.flagship.lease_ledger.ledger.PostingLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a database query: outbox backlog and ledger integrity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final PostingLedger postingLedger;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        refreshLedgerIntegrity();
    }

    void refreshLedgerIntegrity() {
        try {
            long unbalanced = postingLedger.countUnbalancedVouchers();
            ledgerMetrics.updateUnbalancedVouchers(unbalanced);
            if (unbalanced > 0) {
                log.error("{} unbalanced vouchers found in the ledger", unbalanced);
            }
        } catch (Exception e) {
            log.warn("Failed to refresh ledger integrity metrics: {}", e.getMessage());
        }
    }
}
