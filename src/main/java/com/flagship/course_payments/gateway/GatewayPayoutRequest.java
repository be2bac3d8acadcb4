package com.flagship.course_payments.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Payout request body. {@code referenceId} carries the payout's payoutCheckId so the
 * gateway's payout webhooks can be matched back to the record.
 */
@Value
@Builder(toBuilder = true)
public class GatewayPayoutRequest {

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("fund_account_id")
    String fundAccountId;

    /** Minor units. */
    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @Builder.Default
    @JsonProperty("mode")
    String mode = "IMPS";

    @Builder.Default
    @JsonProperty("purpose")
    String purpose = "payout";

    @Builder.Default
    @JsonProperty("queue_if_low_balance")
    boolean queueIfLowBalance = true;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("narration")
    String narration;

    /** Sent as a header, not in the body. Falls back to {@code referenceId} when unset. */
    @JsonIgnore
    String idempotencyKey;

    public String effectiveIdempotencyKey() {
        return idempotencyKey != null ? idempotencyKey : referenceId;
    }
}
