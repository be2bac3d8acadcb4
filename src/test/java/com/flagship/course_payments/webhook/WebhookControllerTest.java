package com.flagship.course_payments.webhook;

import com.flagship.course_payments.exception.SignatureMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = WebhookController.class)
class WebhookControllerTest {

    private static final String BODY = "{\"event\":\"payment.captured\",\"payload\":{}}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WebhookReceiverService receiverService;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("The exact request bytes and headers reach the receiver")
    void passesRawBody() throws Exception {
        printTestHeader("Webhook accepted");
        UUID intentId = UUID.randomUUID();
        byte[] raw = BODY.getBytes(StandardCharsets.UTF_8);
        when(receiverService.receive(eq(raw), eq("abc123"), eq("evt_1"))).thenReturn(WebhookAck.builder()
                .outcome("settled").status("succeeded").intentId(intentId).build());

        mockMvc.perform(post("/api/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Razorpay-Signature", "abc123")
                        .header("X-Razorpay-Event-Id", "evt_1")
                        .content(raw))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("settled"))
                .andExpect(jsonPath("$.status").value("succeeded"))
                .andExpect(jsonPath("$.intentId").value(intentId.toString()))
                .andExpect(jsonPath("$.payoutId").doesNotExist());

        verify(receiverService).receive(eq(raw), eq("abc123"), eq("evt_1"));
        printSuccess("200 with ack body");
    }

    @Test
    @DisplayName("Missing signature header is a 400 and nothing is processed")
    void missingSignatureHeader() throws Exception {
        mockMvc.perform(post("/api/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"));

        verifyNoInteractions(receiverService);
    }

    @Test
    @DisplayName("Signature mismatch is a 400")
    void signatureMismatch() throws Exception {
        when(receiverService.receive(any(), eq("forged"), any()))
                .thenThrow(new SignatureMismatchException("webhook signature mismatch"));

        mockMvc.perform(post("/api/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Razorpay-Signature", "forged")
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Signature Mismatch"));
    }

    @Test
    @DisplayName("Signed webhook naming no order is a 400")
    void missingOrderId() throws Exception {
        when(receiverService.receive(any(), eq("abc123"), any()))
                .thenThrow(new IllegalArgumentException("order id missing"));

        mockMvc.perform(post("/api/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Razorpay-Signature", "abc123")
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("order id missing"));
    }
}
