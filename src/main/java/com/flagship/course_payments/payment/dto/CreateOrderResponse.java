package com.flagship.course_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.course_payments.payment.CheckoutOrder;
import com.flagship.course_payments.payment.PaymentIntent;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class CreateOrderResponse {

    @JsonProperty("orderId")
    String orderId;

    /** Minor units. */
    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("intentId")
    UUID intentId;

    @JsonProperty("gatewayKey")
    String gatewayKey;

    @JsonProperty("product")
    Product product;

    @Value
    public static class Product {
        @JsonProperty("title")
        String title;

        @JsonProperty("type")
        String type;
    }

    public static CreateOrderResponse from(CheckoutOrder order) {
        PaymentIntent intent = order.getIntent();
        return CreateOrderResponse.builder()
            .orderId(intent.getGatewayOrderId())
            .amount(intent.getAmount())
            .currency(intent.getCurrency().name())
            .intentId(intent.getId())
            .gatewayKey(order.getGatewayKey())
            .product(new Product(order.getProductTitle(), intent.getProductType().getWireName()))
            .build();
    }
}
