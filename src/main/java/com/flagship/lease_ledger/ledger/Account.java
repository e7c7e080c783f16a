package com.flagship.lease_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A ledger account. Chart-of-accounts maintenance lives elsewhere; the ledger only needs to
 * resolve references and know which side increases the balance.
 */
@Value
public class Account {
    UUID id;
    String accountRef;
    String name;
    AccountType accountType;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY,
        INCOME,
        EXPENSE;

        /**
         * Debits increase assets and expenses; credits increase everything else.
         */
        public boolean isDebitNormal() {
            return this == ASSET || this == EXPENSE;
        }
    }
}
