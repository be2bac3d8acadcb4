package com.flagship.course_payments.payout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.crypto.SignatureVerifier;
import com.flagship.course_payments.gateway.GatewayPayout;
import com.flagship.course_payments.gateway.GatewayPayoutRequest;
import com.flagship.course_payments.gateway.PaymentGatewayClient;
import com.flagship.course_payments.payout.invoice.InvoiceDelivery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Educator payouts against PostgreSQL: initiation through the gateway, reconciliation by
 * webhook and the invoice sent on the first transition to paid.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class PayoutFlowIntegrationTest {

    static final String WEBHOOK_SECRET = "it_webhook_secret";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("course_payments_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("webhook.dedup.redis-enabled", () -> "false");
        registry.add("gateway.razorpay.key-id", () -> "rzp_test_key");
        registry.add("gateway.razorpay.key-secret", () -> "it_key_secret");
        registry.add("gateway.razorpay.webhook-secret", () -> WEBHOOK_SECRET);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PaymentGatewayClient gatewayClient;

    @MockBean
    private InvoiceDelivery invoiceDelivery;

    private UUID educatorId;
    private UUID payoutId;
    private String payoutCheckId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        educatorId = UUID.randomUUID();
        payoutId = UUID.randomUUID();
        payoutCheckId = "PC-" + payoutId;
        jdbcTemplate.update("INSERT INTO educators (id, full_name, email, fund_account_id) VALUES (?, ?, ?, ?)",
                educatorId, "Dr. Meera Iyer", "meera-" + educatorId + "@example.com", "fa_" + educatorId.toString().substring(0, 8));
        jdbcTemplate.update("""
                INSERT INTO payouts (id, educator_id, gross_amount, commission_amount, amount, scheduled_date,
                                     payout_check_id, month, year)
                VALUES (?, ?, 125000, 25000, 100000, DATE '2026-03-05', ?, 2, 2026)
                """, payoutId, educatorId, payoutCheckId);

        when(gatewayClient.createPayout(any(GatewayPayoutRequest.class))).thenAnswer(inv -> {
            GatewayPayoutRequest request = inv.getArgument(0);
            return GatewayPayout.builder()
                    .id("pout_" + request.getReferenceId().substring(3, 15))
                    .status("processing")
                    .referenceId(request.getReferenceId())
                    .build();
        });
    }

    private String payoutWebhook(String event) {
        return "{\"event\":\"" + event + "\",\"payload\":{\"payout\":{\"entity\":{"
                + "\"id\":\"pout_x\",\"reference_id\":\"" + payoutCheckId + "\","
                + "\"failure_reason\":\"Beneficiary bank offline\"}}}}";
    }

    private String postWebhook(String body, String eventId) throws Exception {
        byte[] raw = body.getBytes(StandardCharsets.UTF_8);
        MvcResult result = mockMvc.perform(post("/api/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Razorpay-Signature", SignatureVerifier.hmacSha256Hex(WEBHOOK_SECRET, raw))
                        .header("X-Razorpay-Event-Id", eventId)
                        .content(raw))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("outcome").asText();
    }

    private String payoutStatus() {
        return jdbcTemplate.queryForObject("SELECT status FROM payouts WHERE id = ?", String.class, payoutId);
    }

    @Test
    @DisplayName("Initiation sends the payout check id as reference and moves the payout to processing")
    void initiateMovesToProcessing() throws Exception {
        printTestHeader("Initiate payout");

        mockMvc.perform(post("/api/payouts/{payoutId}/initiate", payoutId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.narration").value("Payout for 2/2026"));

        ArgumentCaptor<GatewayPayoutRequest> request = ArgumentCaptor.forClass(GatewayPayoutRequest.class);
        verify(gatewayClient).createPayout(request.capture());
        assertEquals(payoutCheckId, request.getValue().getReferenceId());
        assertEquals(100000L, request.getValue().getAmount());
        assertEquals("PROCESSING", payoutStatus());
        printSuccess("Payout processing");
    }

    @Test
    @DisplayName("payout.processed delivered twice marks paid and sends one invoice")
    void processedTwiceSendsOneInvoice() throws Exception {
        printTestHeader("Payout reconciliation with redelivery");
        mockMvc.perform(post("/api/payouts/{payoutId}/initiate", payoutId)).andExpect(status().isOk());

        String first = postWebhook(payoutWebhook("payout.processed"), "evt_p1_" + payoutId);
        String second = postWebhook(payoutWebhook("payout.processed"), "evt_p2_" + payoutId);
        printOutput("First", first);
        printOutput("Second", second);

        assertEquals("PAID", payoutStatus());
        verify(invoiceDelivery, times(1)).deliverInvoice(
                eq("meera-" + educatorId + "@example.com"), any(Payout.class), any(Educator.class), any());
        printSuccess("One invoice for two deliveries");
    }

    @Test
    @DisplayName("A failed payout records the reason and can be initiated again")
    void failedPayoutCanBeRetried() throws Exception {
        mockMvc.perform(post("/api/payouts/{payoutId}/initiate", payoutId)).andExpect(status().isOk());

        postWebhook(payoutWebhook("payout.failed"), "evt_pf_" + payoutId);

        assertEquals("FAILED", payoutStatus());
        assertEquals("Beneficiary bank offline", jdbcTemplate.queryForObject(
                "SELECT failure_reason FROM payouts WHERE id = ?", String.class, payoutId));
        verify(invoiceDelivery, never()).deliverInvoice(any(), any(), any(), any());

        mockMvc.perform(post("/api/payouts/{payoutId}/initiate", payoutId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processing"));
        ArgumentCaptor<GatewayPayoutRequest> requests = ArgumentCaptor.forClass(GatewayPayoutRequest.class);
        verify(gatewayClient, times(2)).createPayout(requests.capture());
        GatewayPayoutRequest first = requests.getAllValues().get(0);
        GatewayPayoutRequest retry = requests.getAllValues().get(1);
        assertEquals(payoutCheckId, retry.getReferenceId());
        assertEquals(payoutCheckId + "-1", first.getIdempotencyKey());
        assertEquals(payoutCheckId + "-2", retry.getIdempotencyKey());
        assertEquals(2, jdbcTemplate.queryForObject(
                "SELECT initiation_attempts FROM payouts WHERE id = ?", Integer.class, payoutId).intValue());
    }

    @Test
    @DisplayName("A paid payout cannot be initiated again")
    void paidPayoutRefused() throws Exception {
        jdbcTemplate.update("UPDATE payouts SET status = 'PAID' WHERE id = ?", payoutId);

        mockMvc.perform(post("/api/payouts/{payoutId}/initiate", payoutId))
                .andExpect(status().isConflict());

        verify(gatewayClient, never()).createPayout(any());
    }

    @Test
    @DisplayName("Listing filters by educator and status")
    void listsByEducatorAndStatus() throws Exception {
        mockMvc.perform(get("/api/payouts")
                        .param("educatorId", educatorId.toString())
                        .param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].payoutCheckId").value(payoutCheckId));

        mockMvc.perform(get("/api/payouts")
                        .param("educatorId", educatorId.toString())
                        .param("status", "paid"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));
    }
}
