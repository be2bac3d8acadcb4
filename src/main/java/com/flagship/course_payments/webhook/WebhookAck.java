package com.flagship.course_payments.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Body returned to the gateway. Any 2xx stops redelivery.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookAck {

    static final String DUPLICATE = "duplicate";

    @JsonProperty("outcome")
    String outcome;

    @JsonProperty("status")
    String status;

    @JsonProperty("intentId")
    UUID intentId;

    @JsonProperty("payoutId")
    UUID payoutId;

    static WebhookAck duplicate() {
        return WebhookAck.builder().outcome(DUPLICATE).build();
    }
}
