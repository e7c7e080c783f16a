package com.flagship.lease_ledger.ledger;

import com.flagship.lease_ledger.calculation.MoneyRounding;
import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.document.DocumentType;
import com.flagship.lease_ledger.exception.AlreadyPostedException;
import com.flagship.lease_ledger.exception.NotPostedException;
import com.flagship.lease_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only double-entry ledger for financial documents.
 *
 * Invariants:
 * 1. Every voucher balances (checked here, and again by a deferred trigger at commit)
 * 2. Postings are never updated or deleted, except for the reversal marker
 * 3. A document has at most one active (non-reversed, non-reversal) voucher
 *
 * JDBC only: the ledger tables are written with plain SQL so the database constraints stay the
 * last line of defence.
 */
@Service
@Slf4j
public class PostingLedger {

    private static final String POSTING_COLUMNS =
        "p.id, p.voucher_no, p.line_no, p.posting_date, a.account_ref, p.debit_amount, p.credit_amount, " +
        "p.document_type, p.document_id, p.narration, p.is_reversed, p.reversal_reason, " +
        "p.reversed_by_voucher_no, p.sequence_number";

    private static final String POSTING_SELECT =
        "SELECT " + POSTING_COLUMNS + " FROM postings p JOIN accounts a ON a.id = p.account_id ";

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;
    private final VoucherNumberGenerator voucherNumberGenerator;
    private final LeaseLedgerProperties properties;

    public PostingLedger(JdbcTemplate jdbcTemplate, AccountService accountService,
                         VoucherNumberGenerator voucherNumberGenerator, LeaseLedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountService = accountService;
        this.voucherNumberGenerator = voucherNumberGenerator;
        this.properties = properties;
    }

    /**
     * Writes a balanced two-line voucher for a document.
     *
     * @throws ValidationException if the amount is not positive or the accounts are unknown or equal
     * @throws AlreadyPostedException if the document still has an active voucher
     */
    @Transactional
    public PostingResult post(DocumentRef document, PostingRequest request, String actor) {
        BigDecimal amount = validate(request);
        Account debitAccount = requireAccount(request.getDebitAccountRef());
        Account creditAccount = requireAccount(request.getCreditAccountRef());

        if (hasActivePostings(document)) {
            log.warn("Refusing to post {}: active postings exist", document);
            throw new AlreadyPostedException(document);
        }

        String voucherNo = voucherNumberGenerator.next(properties.getVouchers().getPostingPrefix(),
                request.getPostingDate());
        MDC.put("voucherNo", voucherNo);
        try {
            insertVoucher(voucherNo, request.getPostingDate(), document, request.getNarration(), null, actor);
            insertPosting(voucherNo, 1, request.getPostingDate(), debitAccount.getId(), amount, BigDecimal.ZERO,
                    document, request.getNarration());
            insertPosting(voucherNo, 2, request.getPostingDate(), creditAccount.getId(), BigDecimal.ZERO, amount,
                    document, request.getNarration());

            // deferred trigger re-checks the voucher balance at commit

            log.info("Posted {}: voucher={}, debit={}, credit={}, amount={}",
                    document, voucherNo, debitAccount.getAccountRef(), creditAccount.getAccountRef(), amount);
            return new PostingResult(voucherNo, document, findByVoucher(voucherNo));
        } finally {
            MDC.remove("voucherNo");
        }
    }

    /**
     * Reverses the whole voucher the posting belongs to.
     *
     * Appends the offsetting lines under a new voucher and marks the original lines reversed.
     *
     * @throws NotPostedException if the posting does not exist, is already reversed, or is itself a reversal line
     */
    @Transactional
    public ReversalResult reverse(UUID postingId, String reason, LocalDate reversalDate, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reversal reason is required");
        }
        Posting posting = findById(postingId)
            .orElseThrow(() -> new NotPostedException("Posting not found: " + postingId));

        String originalVoucher = posting.getVoucherNo();
        List<Posting> originals = lockVoucher(originalVoucher);
        if (originals.stream().anyMatch(Posting::isReversed)) {
            throw new NotPostedException(String.format("Voucher %s is already reversed", originalVoucher));
        }
        if (isReversalVoucher(originalVoucher)) {
            throw new NotPostedException(String.format("Voucher %s is a reversal and cannot be reversed", originalVoucher));
        }

        LocalDate date = reversalDate != null ? reversalDate : LocalDate.now();
        DocumentRef document = posting.getDocument();
        String reversalVoucher = voucherNumberGenerator.next(properties.getVouchers().getReversalPrefix(), date);
        String narration = "Reversal of " + originalVoucher + ": " + reason.trim();

        MDC.put("voucherNo", reversalVoucher);
        try {
            insertVoucher(reversalVoucher, date, document, narration, originalVoucher, actor);
            int lineNo = 1;
            for (Posting original : originals) {
                UUID accountId = requireAccount(original.getAccountRef()).getId();
                // debit and credit swap sides
                insertPosting(reversalVoucher, lineNo++, date, accountId,
                        original.getCreditAmount(), original.getDebitAmount(), document, narration);
            }

            int marked = jdbcTemplate.update(
                "UPDATE postings SET is_reversed = TRUE, reversal_reason = ?, reversed_by_voucher_no = ?, " +
                "reversed_at = CURRENT_TIMESTAMP WHERE voucher_no = ? AND is_reversed = FALSE",
                reason.trim(), reversalVoucher, originalVoucher
            );
            if (marked != originals.size()) {
                throw new NotPostedException(String.format("Voucher %s changed while reversing", originalVoucher));
            }

            log.info("Reversed voucher {} of {} with {}: reason={}", originalVoucher, document, reversalVoucher, reason);
            return new ReversalResult(originalVoucher, reversalVoucher, document, reason.trim(),
                    findByVoucher(reversalVoucher));
        } finally {
            MDC.remove("voucherNo");
        }
    }

    /**
     * Reverses the document's active voucher.
     *
     * @throws NotPostedException if the document has no active voucher
     */
    @Transactional
    public ReversalResult reverseDocument(DocumentRef document, String reason, LocalDate reversalDate, String actor) {
        Posting active = findActivePostings(document).stream()
            .findFirst()
            .orElseThrow(() -> new NotPostedException(document + " has no active postings to reverse"));
        return reverse(active.getId(), reason, reversalDate, actor);
    }

    /**
     * True when the document has postings that are neither reversed nor reversal lines.
     */
    @Transactional(readOnly = true)
    public boolean hasActivePostings(DocumentRef document) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM postings p JOIN vouchers v ON v.voucher_no = p.voucher_no " +
            "WHERE p.document_type = ? AND p.document_id = ? AND p.is_reversed = FALSE " +
            "AND v.reverses_voucher_no IS NULL",
            Integer.class,
            document.getType().name(),
            document.getId()
        );
        return count != null && count > 0;
    }

    @Transactional(readOnly = true)
    public List<Posting> findActivePostings(DocumentRef document) {
        return jdbcTemplate.query(
            POSTING_SELECT + "JOIN vouchers v ON v.voucher_no = p.voucher_no " +
            "WHERE p.document_type = ? AND p.document_id = ? AND p.is_reversed = FALSE " +
            "AND v.reverses_voucher_no IS NULL ORDER BY p.sequence_number",
            postingRowMapper(),
            document.getType().name(),
            document.getId()
        );
    }

    @Transactional(readOnly = true)
    public List<Posting> findByDocument(DocumentRef document) {
        return jdbcTemplate.query(
            POSTING_SELECT + "WHERE p.document_type = ? AND p.document_id = ? ORDER BY p.sequence_number",
            postingRowMapper(),
            document.getType().name(),
            document.getId()
        );
    }

    @Transactional(readOnly = true)
    public List<Posting> findByVoucher(String voucherNo) {
        return jdbcTemplate.query(
            POSTING_SELECT + "WHERE p.voucher_no = ? ORDER BY p.line_no",
            postingRowMapper(),
            voucherNo
        );
    }

    @Transactional(readOnly = true)
    public Optional<Posting> findById(UUID postingId) {
        return jdbcTemplate.query(POSTING_SELECT + "WHERE p.id = ?", postingRowMapper(), postingId)
            .stream()
            .findFirst();
    }

    /**
     * Balance derived from postings. Balances are never stored.
     */
    @Transactional(readOnly = true)
    public BigDecimal getAccountBalance(String accountRef) {
        Account account = requireAccount(accountRef);
        BigDecimal net = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit_amount - credit_amount), 0) FROM postings WHERE account_id = ?",
            BigDecimal.class,
            account.getId()
        );
        BigDecimal debitMinusCredit = net != null ? net : BigDecimal.ZERO;
        return MoneyRounding.round2(account.getAccountType().isDebitNormal() ? debitMinusCredit : debitMinusCredit.negate());
    }

    /**
     * Number of vouchers whose debits and credits differ. Always zero unless the schema
     * constraints have been bypassed.
     */
    @Transactional(readOnly = true)
    public long countUnbalancedVouchers() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM (SELECT voucher_no FROM postings GROUP BY voucher_no " +
            "HAVING SUM(debit_amount) <> SUM(credit_amount)) unbalanced",
            Long.class
        );
        return count != null ? count : 0L;
    }

    private BigDecimal validate(PostingRequest request) {
        if (request == null) {
            throw new ValidationException("Posting request is required");
        }
        if (request.getPostingDate() == null) {
            throw new ValidationException("Posting date is required");
        }
        if (request.getAmount() == null || request.getAmount().signum() <= 0) {
            throw new ValidationException("Posting amount must be positive");
        }
        if (isBlank(request.getDebitAccountRef()) || isBlank(request.getCreditAccountRef())) {
            throw new ValidationException("Debit and credit accounts are required");
        }
        if (request.getDebitAccountRef().equals(request.getCreditAccountRef())) {
            throw new ValidationException("Debit and credit accounts must be different");
        }
        BigDecimal amount = MoneyRounding.round2(request.getAmount());
        if (amount.signum() <= 0) {
            throw new ValidationException("Posting amount must be at least 0.01");
        }
        return amount;
    }

    private Account requireAccount(String accountRef) {
        return accountService.findByRef(accountRef)
            .orElseThrow(() -> new ValidationException("Account not found: " + accountRef));
    }

    private boolean isReversalVoucher(String voucherNo) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vouchers WHERE voucher_no = ? AND reverses_voucher_no IS NOT NULL",
            Integer.class,
            voucherNo
        );
        return count != null && count > 0;
    }

    private List<Posting> lockVoucher(String voucherNo) {
        return jdbcTemplate.query(
            POSTING_SELECT + "WHERE p.voucher_no = ? ORDER BY p.line_no FOR UPDATE OF p",
            postingRowMapper(),
            voucherNo
        );
    }

    private void insertVoucher(String voucherNo, LocalDate date, DocumentRef document, String narration,
                               String reversesVoucherNo, String actor) {
        jdbcTemplate.update(
            "INSERT INTO vouchers (voucher_no, voucher_date, document_type, document_id, narration, " +
            "reverses_voucher_no, created_by, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            voucherNo,
            date,
            document.getType().name(),
            document.getId(),
            narration,
            reversesVoucherNo,
            actor
        );
    }

    private void insertPosting(String voucherNo, int lineNo, LocalDate date, UUID accountId,
                               BigDecimal debit, BigDecimal credit, DocumentRef document, String narration) {
        jdbcTemplate.update(
            "INSERT INTO postings (id, voucher_no, line_no, posting_date, account_id, debit_amount, credit_amount, " +
            "document_type, document_id, narration, is_reversed, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE, CURRENT_TIMESTAMP)",
            voucherNo,
            lineNo,
            date,
            accountId,
            debit,
            credit,
            document.getType().name(),
            document.getId(),
            narration
        );
    }

    private RowMapper<Posting> postingRowMapper() {
        return (rs, rowNum) -> new Posting(
            UUID.fromString(rs.getString("id")),
            rs.getString("voucher_no"),
            rs.getInt("line_no"),
            rs.getObject("posting_date", LocalDate.class),
            rs.getString("account_ref"),
            rs.getBigDecimal("debit_amount"),
            rs.getBigDecimal("credit_amount"),
            DocumentRef.of(DocumentType.valueOf(rs.getString("document_type")),
                UUID.fromString(rs.getString("document_id"))),
            rs.getString("narration"),
            rs.getBoolean("is_reversed"),
            rs.getString("reversal_reason"),
            rs.getString("reversed_by_voucher_no"),
            rs.getLong("sequence_number")
        );
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
