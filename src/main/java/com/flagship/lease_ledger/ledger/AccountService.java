package com.flagship.lease_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account lookup and creation.
 */
@Service
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public UUID createAccount(String accountRef, String name, Account.AccountType accountType) {
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, account_ref, name, account_type, created_at) VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
            accountId,
            accountRef,
            name,
            accountType.name()
        );
        return accountId;
    }

    public Optional<Account> findByRef(String accountRef) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT id, account_ref, name, account_type FROM accounts WHERE account_ref = ?",
            accountRowMapper(),
            accountRef
        );
        return accounts.stream().findFirst();
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("account_ref"),
            rs.getString("name"),
            Account.AccountType.valueOf(rs.getString("account_type"))
        );
    }
}
