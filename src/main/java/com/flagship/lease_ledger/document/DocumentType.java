package com.flagship.lease_ledger.document;

/**
 * The financial document families handled by the engine.
 * The aggregate name doubles as the outbox aggregate type.
 */
public enum DocumentType {
    CONTRACT("Contract"),
    RECEIPT("Receipt");

    private final String aggregateName;

    DocumentType(String aggregateName) {
        this.aggregateName = aggregateName;
    }

    public String getAggregateName() {
        return aggregateName;
    }

    /**
     * @throws IllegalArgumentException if no document type uses the name
     */
    public static DocumentType fromAggregateName(String aggregateName) {
        for (DocumentType type : values()) {
            if (type.aggregateName.equals(aggregateName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown document aggregate type: " + aggregateName);
    }
}
