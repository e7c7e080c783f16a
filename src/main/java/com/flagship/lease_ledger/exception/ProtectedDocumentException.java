package com.flagship.lease_ledger.exception;

import com.flagship.lease_ledger.document.DocumentRef;
import lombok.Getter;

/**
 * A mutation was attempted on an approved document.
 */
@Getter
public class ProtectedDocumentException extends IllegalStateException {

    private final DocumentRef document;
    private final String operation;

    public ProtectedDocumentException(DocumentRef document, String operation) {
        super(String.format("%s is approved and cannot be changed (%s). Request an approval reset first.",
                document, operation));
        this.document = document;
        this.operation = operation;
    }
}
