package com.flagship.course_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Purchase request. The price is never taken from the client.
 */
@Value
@Builder
@Jacksonized
public class CreateOrderRequest {

    @NotNull(message = "Student ID is required")
    @JsonProperty("studentId")
    UUID studentId;

    @NotBlank(message = "Product type is required")
    @JsonProperty("productType")
    String productType;

    @NotNull(message = "Product ID is required")
    @JsonProperty("productId")
    UUID productId;
}
