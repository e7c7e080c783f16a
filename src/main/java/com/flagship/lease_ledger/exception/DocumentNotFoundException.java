package com.flagship.lease_ledger.exception;

import com.flagship.lease_ledger.document.DocumentRef;

public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(DocumentRef document) {
        super(document + " not found");
    }

    public DocumentNotFoundException(String message) {
        super(message);
    }
}
