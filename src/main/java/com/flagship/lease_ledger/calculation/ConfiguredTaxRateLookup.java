package com.flagship.lease_ledger.calculation;

import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Tax rates from {@code lease.tax-rates}.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredTaxRateLookup implements TaxRateLookup {

    private final LeaseLedgerProperties properties;

    @Override
    public Optional<BigDecimal> getTaxRate(String taxRateId) {
        return Optional.ofNullable(properties.getTaxRates().get(taxRateId));
    }
}
