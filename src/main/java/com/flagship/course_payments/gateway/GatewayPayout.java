package com.flagship.course_payments.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayPayout {

    @JsonProperty("id")
    String id;

    @JsonProperty("status")
    String status;

    @JsonProperty("reference_id")
    String referenceId;
}
