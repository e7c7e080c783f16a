package com.flagship.lease_ledger.receipt;

import lombok.Value;

import java.time.LocalDate;

/**
 * Accounts and date for posting a receipt. The amount is always the receipt's net amount.
 * A null posting date means the receipt date; a null narration is generated.
 */
@Value
public class PostingInstruction {
    String debitAccountRef;
    String creditAccountRef;
    LocalDate postingDate;
    String narration;
}
