package com.flagship.course_payments.gateway;

import com.flagship.course_payments.exception.GatewayCommunicationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Razorpay REST client. Orders go to {@code /v1/orders}, payouts to RazorpayX {@code /v1/payouts}.
 * Constructed by {@link GatewayConfig}; the RestTemplate already carries the root URI,
 * basic auth and timeouts.
 */
@Slf4j
public class RazorpayGatewayClient implements PaymentGatewayClient {

    static final String ORDERS_PATH = "/v1/orders";
    static final String PAYOUTS_PATH = "/v1/payouts";
    static final String PAYOUT_IDEMPOTENCY_HEADER = "X-Payout-Idempotency";

    private final RestTemplate restTemplate;
    private final GatewayProperties properties;

    public RazorpayGatewayClient(RestTemplate restTemplate, GatewayProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public GatewayOrder createOrder(GatewayOrderRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            GatewayOrder order = restTemplate.postForObject(ORDERS_PATH, jsonEntity(request, new HttpHeaders()),
                    GatewayOrder.class);
            if (order == null || order.getId() == null) {
                throw new GatewayCommunicationException("Gateway returned an empty order for receipt "
                        + request.getReceipt(), null);
            }

            log.info("Gateway order created: orderId={}, receipt={}, amount={}, duration={}ms",
                    order.getId(), request.getReceipt(), request.getAmount(),
                    System.currentTimeMillis() - startTime);
            return order;

        } catch (RestClientResponseException e) {
            log.error("Gateway rejected order: receipt={}, status={}, body={}",
                    request.getReceipt(), e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new GatewayCommunicationException("Gateway rejected order creation", e);
        } catch (RestClientException e) {
            log.error("Gateway order call failed: receipt={}, error={}", request.getReceipt(), e.getMessage());
            throw new GatewayCommunicationException("Unable to reach payment gateway", e);
        }
    }

    @Override
    public GatewayPayout createPayout(GatewayPayoutRequest request) {
        GatewayPayoutRequest withAccount = request.toBuilder()
                .accountNumber(properties.getPayoutAccountNumber())
                .build();

        HttpHeaders headers = new HttpHeaders();
        headers.set(PAYOUT_IDEMPOTENCY_HEADER, request.effectiveIdempotencyKey());

        try {
            GatewayPayout payout = restTemplate.postForObject(PAYOUTS_PATH, jsonEntity(withAccount, headers),
                    GatewayPayout.class);
            if (payout == null || payout.getId() == null) {
                throw new GatewayCommunicationException("Gateway returned an empty payout for reference "
                        + request.getReferenceId(), null);
            }

            log.info("Gateway payout requested: gatewayPayoutId={}, reference={}, idempotencyKey={}, status={}",
                    payout.getId(), request.getReferenceId(), request.effectiveIdempotencyKey(), payout.getStatus());
            return payout;

        } catch (RestClientResponseException e) {
            log.error("Gateway rejected payout: reference={}, status={}, body={}",
                    request.getReferenceId(), e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new GatewayCommunicationException("Gateway rejected payout request", e);
        } catch (RestClientException e) {
            log.error("Gateway payout call failed: reference={}, error={}", request.getReferenceId(), e.getMessage());
            throw new GatewayCommunicationException("Unable to reach payment gateway", e);
        }
    }

    @Override
    public String getPublishableKey() {
        return properties.getKeyId();
    }

    private static <T> HttpEntity<T> jsonEntity(T body, HttpHeaders headers) {
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }
}
