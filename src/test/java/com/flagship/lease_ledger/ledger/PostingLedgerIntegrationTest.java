package com.flagship.lease_ledger.ledger;

import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.exception.AlreadyPostedException;
import com.flagship.lease_ledger.exception.NotPostedException;
import com.flagship.lease_ledger.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger behavior against a real Postgres: the balance, append-only and reversal rules are
 * partly enforced by the schema, so they are only meaningful here.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PostingLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("lease_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topics.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    private static final LocalDate POSTING_DATE = LocalDate.of(2024, 3, 1);

    @Autowired
    private PostingLedger postingLedger;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private String cashAccount;
    private String depositAccount;
    private DocumentRef receipt;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        cashAccount = "CASH-" + suffix;
        depositAccount = "DEP-" + suffix;
        accountService.createAccount(cashAccount, "Cash " + suffix, Account.AccountType.ASSET);
        accountService.createAccount(depositAccount, "Deposits " + suffix, Account.AccountType.LIABILITY);
        receipt = DocumentRef.receipt(UUID.randomUUID());
    }

    private PostingRequest request(String amount) {
        return new PostingRequest(POSTING_DATE, cashAccount, depositAccount, new BigDecimal(amount), "Receipt RCT-1");
    }

    @Test
    @DisplayName("Posting writes one debit and one credit under a JV voucher")
    void postWritesBalancedVoucher() {
        PostingResult result = postingLedger.post(receipt, request("5800"), "clerk");

        assertTrue(result.getVoucherNo().startsWith("JV-20240301-"));
        List<Posting> lines = result.getPostings();
        assertEquals(2, lines.size());
        assertEquals(cashAccount, lines.get(0).getAccountRef());
        assertEquals(new BigDecimal("5800.00"), lines.get(0).getDebitAmount());
        assertEquals(0, lines.get(0).getCreditAmount().signum());
        assertEquals(depositAccount, lines.get(1).getAccountRef());
        assertEquals(new BigDecimal("5800.00"), lines.get(1).getCreditAmount());
        assertTrue(lines.get(0).getSequenceNumber() < lines.get(1).getSequenceNumber());

        assertTrue(postingLedger.hasActivePostings(receipt));
        assertEquals(new BigDecimal("5800.00"), postingLedger.getAccountBalance(cashAccount));
        assertEquals(new BigDecimal("5800.00"), postingLedger.getAccountBalance(depositAccount));
        assertEquals(0L, postingLedger.countUnbalancedVouchers());
    }

    @Test
    @DisplayName("A document with an active voucher cannot be posted twice")
    void doublePostIsRefused() {
        postingLedger.post(receipt, request("100"), "clerk");

        assertThrows(AlreadyPostedException.class, () -> postingLedger.post(receipt, request("100"), "clerk"));
        assertEquals(2, postingLedger.findByDocument(receipt).size());
    }

    @Test
    @DisplayName("Reversal appends offsetting lines, marks the originals, and allows a fresh posting")
    void reverseThenRepost() {
        PostingResult posted = postingLedger.post(receipt, request("250.50"), "clerk");
        UUID firstLine = posted.getPostings().get(0).getId();

        ReversalResult reversal = postingLedger.reverse(firstLine, "wrong account", LocalDate.of(2024, 3, 2), "clerk");

        assertEquals(posted.getVoucherNo(), reversal.getReversedVoucherNo());
        assertTrue(reversal.getReversalVoucherNo().startsWith("RV-20240302-"));
        assertEquals(2, reversal.getReversalPostings().size());
        assertEquals(new BigDecimal("250.50"), reversal.getReversalPostings().get(0).getCreditAmount());

        List<Posting> originals = postingLedger.findByVoucher(posted.getVoucherNo());
        assertTrue(originals.stream().allMatch(Posting::isReversed));
        assertTrue(originals.stream().allMatch(p -> reversal.getReversalVoucherNo().equals(p.getReversedByVoucherNo())));
        assertEquals("wrong account", originals.get(0).getReversalReason());

        assertFalse(postingLedger.hasActivePostings(receipt));
        assertEquals(0, postingLedger.getAccountBalance(cashAccount).signum());

        PostingResult reposted = postingLedger.post(receipt, request("250.50"), "clerk");
        assertNotEquals(posted.getVoucherNo(), reposted.getVoucherNo());
        assertEquals(6, postingLedger.findByDocument(receipt).size());
    }

    @Test
    @DisplayName("Reversed vouchers and reversal vouchers cannot be reversed")
    void reversalRules() {
        PostingResult posted = postingLedger.post(receipt, request("10"), "clerk");
        UUID line = posted.getPostings().get(0).getId();
        ReversalResult reversal = postingLedger.reverse(line, "duplicate", null, "clerk");

        assertThrows(NotPostedException.class, () -> postingLedger.reverse(line, "again", null, "clerk"));
        UUID reversalLine = reversal.getReversalPostings().get(0).getId();
        assertThrows(NotPostedException.class, () -> postingLedger.reverse(reversalLine, "undo", null, "clerk"));
        assertThrows(ValidationException.class, () -> postingLedger.reverse(line, " ", null, "clerk"));
        assertThrows(NotPostedException.class, () -> postingLedger.reverseDocument(receipt, "nothing left", null, "clerk"));
    }

    @Test
    @DisplayName("Invalid requests are rejected before anything is written")
    void invalidRequests() {
        assertThrows(ValidationException.class, () -> postingLedger.post(receipt, request("0"), "clerk"));
        assertThrows(ValidationException.class, () -> postingLedger.post(receipt, request("0.004"), "clerk"));
        assertThrows(ValidationException.class, () -> postingLedger.post(receipt,
                new PostingRequest(POSTING_DATE, cashAccount, cashAccount, BigDecimal.TEN, null), "clerk"));
        assertThrows(ValidationException.class, () -> postingLedger.post(receipt,
                new PostingRequest(POSTING_DATE, cashAccount, "NO-SUCH-ACCOUNT", BigDecimal.TEN, null), "clerk"));

        assertTrue(postingLedger.findByDocument(receipt).isEmpty());
    }

    @Test
    @DisplayName("The database refuses to delete postings or rewrite their amounts")
    void postingsAreAppendOnly() {
        PostingResult posted = postingLedger.post(receipt, request("75"), "clerk");

        assertThrows(DataAccessException.class, () ->
                jdbcTemplate.update("DELETE FROM postings WHERE voucher_no = ?", posted.getVoucherNo()));
        assertThrows(DataAccessException.class, () ->
                jdbcTemplate.update("UPDATE postings SET debit_amount = 1 WHERE voucher_no = ? AND line_no = 1",
                        posted.getVoucherNo()));

        assertEquals(2, postingLedger.findByVoucher(posted.getVoucherNo()).size());
    }

    @Test
    @DisplayName("An unbalanced voucher fails when its transaction commits")
    void unbalancedVoucherFailsAtCommit() {
        UUID cashId = accountService.findByRef(cashAccount).orElseThrow().getId();
        String voucherNo = "JV-UNBALANCED-" + UUID.randomUUID().toString().substring(0, 8);
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);

        assertThrows(RuntimeException.class, () -> transaction.executeWithoutResult(status -> {
            jdbcTemplate.update(
                "INSERT INTO vouchers (voucher_no, voucher_date, document_type, document_id) VALUES (?, ?, ?, ?)",
                voucherNo, POSTING_DATE, "RECEIPT", receipt.getId());
            jdbcTemplate.update(
                "INSERT INTO postings (id, voucher_no, line_no, posting_date, account_id, debit_amount, " +
                "credit_amount, document_type, document_id) VALUES (?, ?, 1, ?, ?, 100, 0, 'RECEIPT', ?)",
                UUID.randomUUID(), voucherNo, POSTING_DATE, cashId, receipt.getId());
        }));

        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vouchers WHERE voucher_no = ?", Integer.class, voucherNo);
        assertEquals(0, count);
    }
}
