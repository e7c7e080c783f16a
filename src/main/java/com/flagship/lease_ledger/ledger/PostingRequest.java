package com.flagship.lease_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Two-account posting: one debit and one credit of the same amount.
 */
@Value
public class PostingRequest {
    LocalDate postingDate;
    String debitAccountRef;
    String creditAccountRef;
    BigDecimal amount;
    String narration;
}
