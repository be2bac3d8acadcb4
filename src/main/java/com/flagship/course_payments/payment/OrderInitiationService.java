package com.flagship.course_payments.payment;

import com.flagship.course_payments.catalog.ProductCatalogService;
import com.flagship.course_payments.catalog.ProductDetails;
import com.flagship.course_payments.catalog.ProductType;
import com.flagship.course_payments.catalog.Student;
import com.flagship.course_payments.catalog.StudentDirectory;
import com.flagship.course_payments.exception.BusinessRuleViolationException;
import com.flagship.course_payments.exception.BusinessRuleViolationException.Rule;
import com.flagship.course_payments.gateway.GatewayOrder;
import com.flagship.course_payments.gateway.GatewayOrderRequest;
import com.flagship.course_payments.gateway.PaymentGatewayClient;
import com.flagship.course_payments.observability.CheckoutMetrics;
import com.flagship.course_payments.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a purchase request into a pending payment intent and a gateway order.
 *
 * All validation runs before anything is written. The intent is committed before the
 * gateway is called; if the gateway call fails the intent stays pending and expires.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderInitiationService {

    private final StudentDirectory studentDirectory;
    private final ProductCatalogService productCatalogService;
    private final PaymentIntentPersistenceService persistenceService;
    private final PaymentGatewayClient gatewayClient;
    private final CheckoutProperties checkoutProperties;
    private final CheckoutMetrics checkoutMetrics;
    private final Clock clock;

    /**
     * @param productTypeName wire name, e.g. "course" or "testSeries"
     * @throws BusinessRuleViolationException on an invalid product type, inactive student or product,
     *         full product, invalid price, or an existing enrollment
     * @throws com.flagship.course_payments.exception.ResourceNotFoundException if student or product is missing
     * @throws com.flagship.course_payments.exception.GatewayCommunicationException if the gateway order fails
     */
    public CheckoutOrder createOrder(UUID studentId, String productTypeName, UUID productId) {
        long startTime = System.currentTimeMillis();

        ProductType productType = ProductType.purchasableFrom(productTypeName);
        Student student = studentDirectory.getStudentById(studentId);
        ProductDetails product = productCatalogService.getProductDetails(productType, productId);

        if (productCatalogService.isAlreadyEnrolled(studentId, productType, productId)) {
            throw new BusinessRuleViolationException(Rule.ALREADY_ENROLLED,
                    "Student " + studentId + " is already enrolled in " + productType.getWireName() + " " + productId);
        }

        CurrencyCode currency = checkoutProperties.getCurrency();
        long amount = currency.toMinorUnits(product.getPrice());
        Instant expiresAt = clock.instant().plus(checkoutProperties.getIntentTtl());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("studentName", student.getName());
        metadata.put("studentEmail", student.getEmail());

        PaymentIntent intent = persistenceService.createPending(PaymentIntent.pending(
                studentId, productType, productId, amount, currency, product.getSnapshot(), metadata, expiresAt));

        MDC.put(CorrelationContext.INTENT_ID_MDC_KEY, intent.getId().toString());
        try {
            String receipt = checkoutProperties.getReceiptPrefix() + intent.getId().toString().replace("-", "");

            GatewayOrder order = gatewayClient.createOrder(GatewayOrderRequest.builder()
                    .amount(amount)
                    .currency(currency.name())
                    .receipt(receipt)
                    .note("paymentIntentId", intent.getId().toString())
                    .note("studentId", studentId.toString())
                    .note("productId", productId.toString())
                    .note("productType", productType.getWireName())
                    .build());

            PaymentIntent withOrder = persistenceService.attachGatewayOrder(intent.getId(), order.getId(), receipt);

            long duration = System.currentTimeMillis() - startTime;
            checkoutMetrics.recordOrderCreated(productType.getWireName(), currency.name());
            checkoutMetrics.recordLatency("create_order", duration);
            log.info("Checkout order created: gatewayOrderId={}, productType={}, amount={}, currency={}, duration={}ms",
                    order.getId(), productType.getWireName(), amount, currency, duration);

            return CheckoutOrder.builder()
                    .intent(withOrder)
                    .gatewayKey(gatewayClient.getPublishableKey())
                    .productTitle(product.getTitle())
                    .build();

        } catch (RuntimeException e) {
            log.error("Order initiation failed, intent left pending until expiry: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.INTENT_ID_MDC_KEY);
        }
    }
}
