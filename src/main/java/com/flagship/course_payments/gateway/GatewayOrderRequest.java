package com.flagship.course_payments.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GatewayOrderRequest {

    /** Minor units. */
    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("receipt")
    String receipt;

    @Singular
    @JsonProperty("notes")
    Map<String, String> notes;
}
