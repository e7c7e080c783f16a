package com.flagship.lease_ledger.receipt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.lease_ledger.ledger.PostingLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * A receipt from creation to reversal through the HTTP API, against Postgres and Redis.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ReceiptFlowIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("lease_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topics.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PostingLedger postingLedger;

    private String invoiceA;
    private String invoiceB;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        invoiceA = "INV-A-" + suffix;
        invoiceB = "INV-B-" + suffix;
        jdbcTemplate.update("INSERT INTO invoices (invoice_ref, customer_ref, outstanding_balance) VALUES (?, ?, ?)",
                invoiceA, "CUST-1", new BigDecimal("4000.00"));
        jdbcTemplate.update("INSERT INTO invoices (invoice_ref, customer_ref, outstanding_balance) VALUES (?, ?, ?)",
                invoiceB, "CUST-1", new BigDecimal("3000.00"));
    }

    private MvcResult createReceipt(String idempotencyKey, String receiptNo, String amount) throws Exception {
        return mockMvc.perform(post("/api/receipts")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", idempotencyKey)
                .header("X-Actor", "clerk")
                .content("""
                    {
                      "receipt_no": "%s",
                      "customer_ref": "CUST-1",
                      "receipt_date": "2024-03-01",
                      "payment_type": "BANK_TRANSFER",
                      "received_amount": %s,
                      "security_deposit": 1000.00,
                      "discount": 200.00
                    }
                    """.formatted(receiptNo, amount)))
            .andReturn();
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private List<String> outboxEventTypes(UUID aggregateId) {
        return jdbcTemplate.queryForList(
            "SELECT event_type FROM outbox_events WHERE aggregate_id = ? ORDER BY sequence_number",
            String.class, aggregateId);
    }

    @Test
    @DisplayName("Create, allocate, post, reverse and re-post a receipt")
    void fullLifecycle() throws Exception {
        String key = "flow-" + UUID.randomUUID();
        MvcResult created = createReceipt(key, "RCT-FLOW-1", "5000.00");
        assertEquals(201, created.getResponse().getStatus());
        JsonNode receipt = json(created);
        UUID receiptId = UUID.fromString(receipt.get("id").asText());
        assertEquals(new BigDecimal("5800.00"), receipt.get("net_amount").decimalValue());
        assertEquals("RECEIVED", receipt.get("payment_status").asText());

        // same key, different body: the first receipt comes back
        MvcResult repeated = createReceipt(key, "RCT-FLOW-OTHER", "1.00");
        assertEquals(200, repeated.getResponse().getStatus());
        assertEquals(receiptId.toString(), json(repeated).get("id").asText());

        String allocation = """
            {"mode": "PROPORTIONAL", "entries": [{"invoice_ref": "%s"}, {"invoice_ref": "%s"}]}
            """.formatted(invoiceA, invoiceB);
        mockMvc.perform(post("/api/receipts/{id}/allocations/proposal", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(allocation))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allocated_amount").value(5800.00))
            .andExpect(jsonPath("$.allocations.length()").value(2));

        mockMvc.perform(put("/api/receipts/{id}/allocations", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content(allocation))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allocation_mode").value("PROPORTIONAL"))
            .andExpect(jsonPath("$.unallocated_amount").value(0.00));

        MvcResult posted = mockMvc.perform(post("/api/receipts/{id}/postings", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content("{\"debit_account_ref\": \"BANK\", \"credit_account_ref\": \"AR\"}"))
            .andExpect(status().isCreated())
            .andReturn();
        String voucherNo = json(posted).get("voucher_no").asText();
        String postingId = json(posted).get("postings").get(0).get("id").asText();

        mockMvc.perform(get("/api/receipts/{id}", receiptId))
            .andExpect(jsonPath("$.is_posted").value(true))
            .andExpect(jsonPath("$.posted_voucher_no").value(voucherNo));

        // posted receipts stay as they are until reversed
        mockMvc.perform(post("/api/receipts/{id}/postings", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content("{\"debit_account_ref\": \"BANK\", \"credit_account_ref\": \"AR\"}"))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/postings/{postingId}/reversal", postingId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content("{\"reason\": \"posted to the wrong bank\", \"reversal_date\": \"2024-03-05\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.reversed_voucher_no").value(voucherNo))
            .andExpect(jsonPath("$.postings.length()").value(2));

        mockMvc.perform(get("/api/receipts/{id}", receiptId))
            .andExpect(jsonPath("$.is_posted").value(false));

        mockMvc.perform(post("/api/receipts/{id}/postings", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content("{\"debit_account_ref\": \"CASH\", \"credit_account_ref\": \"AR\"}"))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/receipts/{id}/postings", receiptId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(6));

        assertEquals(0L, postingLedger.countUnbalancedVouchers());
        assertEquals(List.of("ReceiptCreated", "DocumentPosted", "PostingReversed", "DocumentPosted"),
                outboxEventTypes(receiptId));
    }

    @Test
    @DisplayName("Receipts over the threshold need approval before they can be posted, and are locked once approved")
    void approvalGatesPosting() throws Exception {
        MvcResult created = createReceipt("flow-" + UUID.randomUUID(), "RCT-FLOW-BIG", "60000.00");
        JsonNode receipt = json(created);
        UUID receiptId = UUID.fromString(receipt.get("id").asText());
        assertEquals("PENDING", receipt.get("approval_status").asText());

        String postBody = "{\"debit_account_ref\": \"BANK\", \"credit_account_ref\": \"AR\"}";
        mockMvc.perform(post("/api/receipts/{id}/postings", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content(postBody))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/receipts/{id}/approval/approve", receiptId)
                .header("X-Actor", "clerk"))
            .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/receipts/{id}/approval/approve", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "finance.manager")
                .content("{\"comment\": \"matched to bank statement\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.approval_status").value("APPROVED"));

        mockMvc.perform(post("/api/receipts/{id}/payment-status", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content("{\"status\": \"CLEARED\", \"clearance_date\": \"2024-03-02\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Document Approved"));

        mockMvc.perform(post("/api/receipts/{id}/postings", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content(postBody))
            .andExpect(status().isCreated());

        assertEquals(List.of("ReceiptCreated", "ApprovalStatusChanged", "DocumentPosted"), outboxEventTypes(receiptId));
    }

    @Test
    @DisplayName("Over-allocation is refused and leaves the receipt unchanged")
    void overAllocationIsRefused() throws Exception {
        UUID receiptId = UUID.fromString(json(createReceipt("flow-" + UUID.randomUUID(), "RCT-FLOW-2", "5000.00"))
                .get("id").asText());

        mockMvc.perform(put("/api/receipts/{id}/allocations", receiptId)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Actor", "clerk")
                .content("""
                    {"mode": "MULTIPLE", "entries": [
                      {"invoice_ref": "%s", "amount": 4000.00},
                      {"invoice_ref": "%s", "amount": 2000.00}
                    ]}
                    """.formatted(invoiceA, invoiceB)))
            .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/api/receipts/{id}", receiptId))
            .andExpect(jsonPath("$.allocations.length()").value(0))
            .andExpect(jsonPath("$.unallocated_amount").value(5800.00));
    }
}
