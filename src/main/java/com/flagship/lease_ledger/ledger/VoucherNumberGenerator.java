package com.flagship.lease_ledger.ledger;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Voucher numbers of the form {@code PREFIX-yyyyMMdd-XXXXXXXX}.
 * The suffix is random; uniqueness is finally guaranteed by the voucher primary key.
 */
@Component
public class VoucherNumberGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public String next(String prefix, LocalDate date) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return prefix + "-" + DATE.format(date) + "-" + suffix;
    }
}
