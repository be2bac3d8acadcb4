package com.flagship.course_payments.payment;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the client checkout needs to open the gateway's payment sheet.
 */
@Value
@Builder
public class CheckoutOrder {
    PaymentIntent intent;
    String gatewayKey;
    String productTitle;
}
