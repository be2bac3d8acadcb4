package com.flagship.course_payments.payment;

import com.flagship.course_payments.exception.ResourceNotFoundException;
import com.flagship.course_payments.payment.dto.CreateOrderRequest;
import com.flagship.course_payments.payment.dto.CreateOrderResponse;
import com.flagship.course_payments.payment.dto.PaymentIntentResponse;
import com.flagship.course_payments.payment.dto.VerifyPaymentRequest;
import com.flagship.course_payments.payment.dto.VerifyPaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Checkout endpoints: open a gateway order, confirm a payment, read an intent.
 * The webhook lives in {@code WebhookController}.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final OrderInitiationService orderInitiationService;
    private final PaymentConfirmationService confirmationService;
    private final PaymentIntentPersistenceService persistenceService;

    @PostMapping("/orders")
    public ResponseEntity<CreateOrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        log.info("Received checkout request: studentId={}, productType={}, productId={}",
                request.getStudentId(), request.getProductType(), request.getProductId());

        CheckoutOrder order = orderInitiationService.createOrder(
                request.getStudentId(), request.getProductType(), request.getProductId());

        return ResponseEntity.status(HttpStatus.CREATED).body(CreateOrderResponse.from(order));
    }

    /**
     * Client-side confirmation. Returns 200 with status succeeded, also when a webhook
     * settled the intent first.
     */
    @PostMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verifyPayment(@Valid @RequestBody VerifyPaymentRequest request) {
        log.info("Received payment verification: orderId={}, paymentId={}, intentId={}",
                request.getOrderId(), request.getPaymentId(), request.getIntentId());

        SettlementResult result = confirmationService.verifyDirect(
                request.getOrderId(), request.getPaymentId(), request.getSignature(), request.getIntentId());

        return ResponseEntity.ok(VerifyPaymentResponse.from(result));
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<PaymentIntentResponse> getPaymentIntent(@PathVariable("intentId") UUID intentId) {
        return persistenceService.findById(intentId)
                .map(intent -> ResponseEntity.ok(PaymentIntentResponse.from(intent)))
                .orElseThrow(() -> new ResourceNotFoundException("payment intent", intentId));
    }
}
