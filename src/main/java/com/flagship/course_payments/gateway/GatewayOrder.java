package com.flagship.course_payments.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Order as returned by the gateway's order API.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayOrder {

    @JsonProperty("id")
    String id;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("receipt")
    String receipt;

    @JsonProperty("status")
    String status;
}
