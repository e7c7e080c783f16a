package com.flagship.lease_ledger.allocation;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Reads outstanding balances from the {@code invoices} table. Never writes to it.
 */
@Component
@RequiredArgsConstructor
public class JdbcInvoiceBalanceLookup implements InvoiceBalanceLookup {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<BigDecimal> getOutstandingBalance(String invoiceRef) {
        List<BigDecimal> balances = jdbcTemplate.queryForList(
            "SELECT outstanding_balance FROM invoices WHERE invoice_ref = ?",
            BigDecimal.class,
            invoiceRef
        );
        return balances.stream().findFirst();
    }
}
