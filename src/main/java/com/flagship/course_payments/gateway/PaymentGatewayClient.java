package com.flagship.course_payments.gateway;

/**
 * Outbound calls to the payment gateway.
 *
 * Implementations throw {@link com.flagship.course_payments.exception.GatewayCommunicationException}
 * when the gateway is unreachable or rejects the request.
 */
public interface PaymentGatewayClient {

    /**
     * Creates a gateway order the client-side checkout will pay against.
     */
    GatewayOrder createOrder(GatewayOrderRequest request);

    /**
     * Requests a bank transfer to an educator's linked fund account.
     */
    GatewayPayout createPayout(GatewayPayoutRequest request);

    /**
     * Public key the checkout widget needs to open the order.
     */
    String getPublishableKey();
}
