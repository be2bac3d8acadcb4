package com.flagship.course_payments.payment;

import com.flagship.course_payments.catalog.ProductType;
import com.flagship.course_payments.exception.BusinessRuleViolationException;
import com.flagship.course_payments.exception.BusinessRuleViolationException.Rule;
import com.flagship.course_payments.exception.IntentExpiredException;
import com.flagship.course_payments.exception.SignatureMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the checkout endpoints: status codes, validation and the error body.
 */
@WebMvcTest(controllers = PaymentController.class)
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrderInitiationService orderInitiationService;

    @MockBean
    private PaymentConfirmationService confirmationService;

    @MockBean
    private PaymentIntentPersistenceService persistenceService;

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

    private static PaymentIntent intent(PaymentIntentStatus status) {
        return PaymentIntent.builder()
                .id(UUID.fromString("6f1c2a9e-3b7d-4c55-9a0e-2d4f8b1e7c10"))
                .studentId(UUID.randomUUID())
                .productId(UUID.randomUUID())
                .productType(ProductType.COURSE)
                .amount(49900)
                .currency(CurrencyCode.INR)
                .status(status)
                .gatewayOrderId("order_abc")
                .gatewayPaymentId("pay_xyz")
                .gatewaySignature("secret-signature")
                .metadata(Map.of())
                .expiresAt(Instant.parse("2026-03-01T10:20:00Z"))
                .build();
    }

    @Test
    @DisplayName("POST /orders returns 201 with the gateway order and publishable key")
    void createOrderReturnsCreated() throws Exception {
        printTestHeader("Create order over HTTP");
        UUID studentId = UUID.randomUUID();
        UUID productId = UUID.randomUUID();
        when(orderInitiationService.createOrder(studentId, "course", productId)).thenReturn(CheckoutOrder.builder()
                .intent(intent(PaymentIntentStatus.PENDING))
                .gatewayKey("rzp_test_key")
                .productTitle("Calculus I")
                .build());

        MvcResult result = mockMvc.perform(post("/api/payments/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\":\"" + studentId + "\",\"productType\":\"course\",\"productId\":\""
                                + productId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderId").value("order_abc"))
                .andExpect(jsonPath("$.amount").value(49900))
                .andExpect(jsonPath("$.currency").value("INR"))
                .andExpect(jsonPath("$.gatewayKey").value("rzp_test_key"))
                .andExpect(jsonPath("$.product.title").value("Calculus I"))
                .andExpect(jsonPath("$.product.type").value("course"))
                .andExpect(header().exists("X-Correlation-ID"))
                .andReturn();

        printOutput("Body", result.getResponse().getContentAsString());
        printSuccess("201 Created");
    }

    @Test
    @DisplayName("Missing productId is a validation failure")
    void createOrderValidation() throws Exception {
        mockMvc.perform(post("/api/payments/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\":\"" + UUID.randomUUID() + "\",\"productType\":\"course\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.productId").exists());

        verifyNoInteractions(orderInitiationService);
    }

    @Test
    @DisplayName("Business rule violation is a 400 naming the rule")
    void createOrderRuleViolation() throws Exception {
        when(orderInitiationService.createOrder(any(), eq("course"), any()))
                .thenThrow(new BusinessRuleViolationException(Rule.ALREADY_ENROLLED, "already enrolled"));

        mockMvc.perform(post("/api/payments/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\":\"" + UUID.randomUUID() + "\",\"productType\":\"course\","
                                + "\"productId\":\"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Business Rule Violation"))
                .andExpect(jsonPath("$.details.rule").value("ALREADY_ENROLLED"));
    }

    @Test
    @DisplayName("POST /verify returns 200 with status succeeded")
    void verifyReturnsSucceeded() throws Exception {
        PaymentIntent succeeded = intent(PaymentIntentStatus.SUCCEEDED);
        when(confirmationService.verifyDirect("order_abc", "pay_xyz", "sig", null))
                .thenReturn(new SettlementResult(SettlementOutcome.ALREADY_SETTLED, succeeded));

        mockMvc.perform(post("/api/payments/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"order_abc\",\"paymentId\":\"pay_xyz\",\"signature\":\"sig\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("succeeded"))
                .andExpect(jsonPath("$.intentId").value(succeeded.getId().toString()));
    }

    @Test
    @DisplayName("Signature mismatch is a 400")
    void verifySignatureMismatch() throws Exception {
        printTestHeader("Forged verification");
        when(confirmationService.verifyDirect("order_abc", "pay_xyz", "forged", null))
                .thenThrow(new SignatureMismatchException("payment signature mismatch"));

        mockMvc.perform(post("/api/payments/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"order_abc\",\"paymentId\":\"pay_xyz\",\"signature\":\"forged\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Signature Mismatch"));
        printSuccess("400 Bad Request");
    }

    @Test
    @DisplayName("Verification after expiry is a 409")
    void verifyExpired() throws Exception {
        when(confirmationService.verifyDirect("order_abc", "pay_xyz", "sig", null))
                .thenThrow(new IntentExpiredException(UUID.randomUUID(), Instant.parse("2026-03-01T10:20:00Z")));

        mockMvc.perform(post("/api/payments/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"order_abc\",\"paymentId\":\"pay_xyz\",\"signature\":\"sig\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Blank signature is a validation failure")
    void verifyValidation() throws Exception {
        mockMvc.perform(post("/api/payments/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"order_abc\",\"paymentId\":\"pay_xyz\",\"signature\":\"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(confirmationService);
    }

    @Test
    @DisplayName("GET /{intentId} returns the intent without its signature")
    void getIntent() throws Exception {
        PaymentIntent intent = intent(PaymentIntentStatus.SUCCEEDED);
        when(persistenceService.findById(intent.getId())).thenReturn(Optional.of(intent));

        mockMvc.perform(get("/api/payments/{intentId}", intent.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("succeeded"))
                .andExpect(jsonPath("$.gatewayOrderId").value("order_abc"))
                .andExpect(jsonPath("$.gatewaySignature").doesNotExist());
    }

    @Test
    @DisplayName("Unknown intent is a 404")
    void getUnknownIntent() throws Exception {
        UUID id = UUID.randomUUID();
        when(persistenceService.findById(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/payments/{intentId}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }
}
