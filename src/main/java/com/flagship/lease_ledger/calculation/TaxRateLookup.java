package com.flagship.lease_ledger.calculation;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Flat tax-rate reference data.
 */
public interface TaxRateLookup {

    /**
     * @param taxRateId tax rate id, never null (null means no tax and is handled by the caller)
     * @return the percentage, e.g. 5.00 for 5%, or empty when the id is unknown
     */
    Optional<BigDecimal> getTaxRate(String taxRateId);
}
