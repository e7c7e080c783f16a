package com.flagship.lease_ledger.exception;

import com.flagship.lease_ledger.document.DocumentRef;

public class AlreadyPostedException extends IllegalStateException {

    public AlreadyPostedException(DocumentRef document) {
        super(document + " is already posted. Reverse the existing posting before posting again.");
    }
}
