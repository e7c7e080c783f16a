package com.flagship.lease_ledger.observability;

import com.flagship.lease_ledger.ledger.PostingLedger;
import com.flagship.lease_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the outbox backlog and ledger balance integrity.
 */
public class HealthIndicators {

    /**
     * WARNING above 1000 waiting events, DOWN above 10000.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * DOWN as soon as a single voucher does not balance.
     */
    @Component("ledgerHealth")
    public static class LedgerIntegrityHealthIndicator implements HealthIndicator {

        private final PostingLedger postingLedger;

        public LedgerIntegrityHealthIndicator(PostingLedger postingLedger) {
            this.postingLedger = postingLedger;
        }

        @Override
        public Health health() {
            try {
                long unbalanced = postingLedger.countUnbalancedVouchers();
                return (unbalanced == 0 ? Health.up() : Health.down())
                        .withDetail("unbalancedVouchers", unbalanced)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }
}
