package com.flagship.lease_ledger.document;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a contract or receipt, used wherever a component must not depend on the
 * concrete document class (ledger postings, approval errors, events).
 */
@Value
public class DocumentRef {
    DocumentType type;
    UUID id;

    public static DocumentRef of(DocumentType type, UUID id) {
        return new DocumentRef(Objects.requireNonNull(type), Objects.requireNonNull(id));
    }

    public static DocumentRef receipt(UUID id) {
        return of(DocumentType.RECEIPT, id);
    }

    public static DocumentRef contract(UUID id) {
        return of(DocumentType.CONTRACT, id);
    }

    @Override
    public String toString() {
        return type.getAggregateName() + " " + id;
    }
}
