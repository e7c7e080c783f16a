package com.flagship.lease_ledger.ledger;

import com.flagship.lease_ledger.document.DocumentRef;
import lombok.Value;

import java.util.List;

@Value
public class PostingResult {
    String voucherNo;
    DocumentRef document;
    List<Posting> postings;
}
