package com.flagship.lease_ledger.ledger;

import com.flagship.lease_ledger.document.DocumentRef;
import lombok.Value;

import java.util.List;

/**
 * Outcome of reversing one voucher: the offsetting voucher and its lines.
 */
@Value
public class ReversalResult {
    String reversedVoucherNo;
    String reversalVoucherNo;
    DocumentRef document;
    String reason;
    List<Posting> reversalPostings;
}
