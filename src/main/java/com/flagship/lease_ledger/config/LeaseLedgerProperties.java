package com.flagship.lease_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code lease.*} configuration tree.
 *
 * <pre>
 * lease:
 *   approval:
 *     threshold: 50000.00
 *     approvers:
 *       approve: [finance.manager]
 *       reject: [finance.manager]
 *       reset: [finance.director]
 *   tax-rates:
 *     VAT5: 5.00
 *   vouchers:
 *     posting-prefix: JV
 *     reversal-prefix: RV
 * </pre>
 */
@ConfigurationProperties(prefix = "lease")
@Getter
@Setter
public class LeaseLedgerProperties {

    private final Approval approval = new Approval();

    /**
     * Flat tax rates (percentages) keyed by tax rate id.
     */
    private Map<String, BigDecimal> taxRates = new LinkedHashMap<>();

    private final Vouchers vouchers = new Vouchers();

    @Getter
    @Setter
    public static class Approval {

        /**
         * Document amount at or above which approval is required.
         * Null means approval is only ever requested explicitly.
         */
        private BigDecimal threshold;

        private final Approvers approvers = new Approvers();
    }

    @Getter
    @Setter
    public static class Approvers {
        private List<String> approve = new ArrayList<>();
        private List<String> reject = new ArrayList<>();
        private List<String> reset = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Vouchers {
        private String postingPrefix = "JV";
        private String reversalPrefix = "RV";
    }
}
