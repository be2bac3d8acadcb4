package com.flagship.course_payments.gateway;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RazorpayGatewayClientTest {

    private MockRestServiceServer server;
    private RazorpayGatewayClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setUriTemplateHandler(new DefaultUriBuilderFactory("https://gateway.test"));
        server = MockRestServiceServer.bindTo(restTemplate).build();

        GatewayProperties properties = new GatewayProperties();
        properties.setPayoutAccountNumber("2323230000001");
        client = new RazorpayGatewayClient(restTemplate, properties);
    }

    private GatewayPayoutRequest.GatewayPayoutRequestBuilder payoutRequest() {
        return GatewayPayoutRequest.builder()
                .fundAccountId("fa_123")
                .amount(100000)
                .currency("INR")
                .referenceId("PC-2026-02-0001")
                .narration("Payout for 2/2026");
    }

    @Test
    @DisplayName("Idempotency key travels as a header and stays out of the body")
    void idempotencyKeyHeader() {
        server.expect(requestTo("https://gateway.test/v1/payouts"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(RazorpayGatewayClient.PAYOUT_IDEMPOTENCY_HEADER, "PC-2026-02-0001-2"))
                .andExpect(jsonPath("$.reference_id").value("PC-2026-02-0001"))
                .andExpect(jsonPath("$.account_number").value("2323230000001"))
                .andExpect(jsonPath("$.idempotencyKey").doesNotExist())
                .andRespond(withSuccess("{\"id\":\"pout_2\",\"status\":\"processing\","
                        + "\"reference_id\":\"PC-2026-02-0001\"}", MediaType.APPLICATION_JSON));

        GatewayPayout payout = client.createPayout(payoutRequest().idempotencyKey("PC-2026-02-0001-2").build());

        assertEquals("pout_2", payout.getId());
        server.verify();
    }

    @Test
    @DisplayName("Without an explicit key the reference id is the idempotency key")
    void referenceIdFallback() {
        server.expect(requestTo("https://gateway.test/v1/payouts"))
                .andExpect(header(RazorpayGatewayClient.PAYOUT_IDEMPOTENCY_HEADER, "PC-2026-02-0001"))
                .andRespond(withSuccess("{\"id\":\"pout_1\",\"status\":\"processing\"}", MediaType.APPLICATION_JSON));

        assertEquals("pout_1", client.createPayout(payoutRequest().build()).getId());
        server.verify();
    }
}
