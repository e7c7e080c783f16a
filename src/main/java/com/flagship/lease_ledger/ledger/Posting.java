package com.flagship.lease_ledger.ledger;

import com.flagship.lease_ledger.document.DocumentRef;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One line of a voucher. Exactly one of debitAmount and creditAmount is non-zero.
 *
 * Postings are never edited or deleted. The only change a posting ever sees is being marked
 * reversed, together with the reason and the voucher that offset it.
 */
@Value
public class Posting {
    UUID id;
    String voucherNo;
    int lineNo;
    LocalDate postingDate;
    String accountRef;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    DocumentRef document;
    String narration;
    boolean reversed;
    String reversalReason;
    String reversedByVoucherNo;
    long sequenceNumber;

    public EntryType getEntryType() {
        return debitAmount.signum() > 0 ? EntryType.DEBIT : EntryType.CREDIT;
    }

    public BigDecimal getAmount() {
        return getEntryType() == EntryType.DEBIT ? debitAmount : creditAmount;
    }
}
