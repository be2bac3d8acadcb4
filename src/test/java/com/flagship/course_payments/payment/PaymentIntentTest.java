package com.flagship.course_payments.payment;

import com.flagship.course_payments.catalog.ProductSnapshot;
import com.flagship.course_payments.catalog.ProductType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Intent construction, the transition graph and expiry.
 */
class PaymentIntentTest {

    private static final Instant EXPIRES_AT = Instant.parse("2026-03-01T10:20:00Z");

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private PaymentIntent pendingIntent() {
        return PaymentIntent.pending(UUID.randomUUID(), ProductType.COURSE, UUID.randomUUID(), 49900,
                CurrencyCode.INR, ProductSnapshot.builder().title("Algebra").fees(new BigDecimal("499.00")).build(),
                Map.of("studentName", "Asha"), EXPIRES_AT);
    }

    @Test
    @DisplayName("A new intent is pending with its amount and snapshot fixed")
    void pendingIntentFields() {
        printTestHeader("Create pending intent");

        PaymentIntent intent = pendingIntent();

        assertNotNull(intent.getId());
        assertEquals(PaymentIntentStatus.PENDING, intent.getStatus());
        assertEquals(49900, intent.getAmount());
        assertEquals("Algebra", intent.getProductSnapshot().getTitle());
        assertNull(intent.getGatewayOrderId());
        assertFalse(intent.isTerminal());
        printSuccess("Intent created in PENDING");
    }

    @Test
    @DisplayName("Zero or negative amounts are refused")
    void refusesNonPositiveAmount() {
        assertThrows(IllegalArgumentException.class, () -> PaymentIntent.pending(UUID.randomUUID(),
                ProductType.COURSE, UUID.randomUUID(), 0, CurrencyCode.INR, null, Map.of(), EXPIRES_AT));
        assertThrows(IllegalArgumentException.class, () -> PaymentIntent.pending(UUID.randomUUID(),
                ProductType.COURSE, UUID.randomUUID(), -100, CurrencyCode.INR, null, Map.of(), EXPIRES_AT));
    }

    @Test
    @DisplayName("Pending may move to authorized, succeeded or failed")
    void pendingTransitions() {
        PaymentIntent intent = pendingIntent();

        assertTrue(intent.canTransitionTo(PaymentIntentStatus.AUTHORIZED));
        assertTrue(intent.canTransitionTo(PaymentIntentStatus.SUCCEEDED));
        assertTrue(intent.canTransitionTo(PaymentIntentStatus.FAILED));
        assertFalse(intent.canTransitionTo(PaymentIntentStatus.CREATED));
    }

    @Test
    @DisplayName("Authorized may only settle or fail")
    void authorizedTransitions() {
        PaymentIntent intent = pendingIntent().toBuilder().status(PaymentIntentStatus.AUTHORIZED).build();

        assertTrue(intent.canTransitionTo(PaymentIntentStatus.SUCCEEDED));
        assertTrue(intent.canTransitionTo(PaymentIntentStatus.FAILED));
        assertFalse(intent.canTransitionTo(PaymentIntentStatus.PENDING));
    }

    @Test
    @DisplayName("Terminal states never move, a failed intent cannot later succeed")
    void terminalStatesAreFinal() {
        printTestHeader("Terminal states");

        PaymentIntent succeeded = pendingIntent().toBuilder().status(PaymentIntentStatus.SUCCEEDED).build();
        PaymentIntent failed = pendingIntent().toBuilder().status(PaymentIntentStatus.FAILED).build();

        assertTrue(succeeded.isTerminal());
        assertFalse(succeeded.canTransitionTo(PaymentIntentStatus.FAILED));
        assertFalse(failed.canTransitionTo(PaymentIntentStatus.SUCCEEDED));
        assertTrue(failed.canTransitionTo(PaymentIntentStatus.FAILED));
        printSuccess("Terminal states rejected every outgoing edge");
    }

    @Test
    @DisplayName("An intent is expired at and after expiresAt")
    void expiryBoundary() {
        PaymentIntent intent = pendingIntent();

        assertFalse(intent.isExpired(EXPIRES_AT.minusMillis(1)));
        assertTrue(intent.isExpired(EXPIRES_AT));
        assertTrue(intent.isExpired(EXPIRES_AT.plusSeconds(60)));
    }

    @Test
    @DisplayName("Major units convert to minor units rounding half up")
    void minorUnitConversion() {
        assertEquals(49900, CurrencyCode.INR.toMinorUnits(new BigDecimal("499")));
        assertEquals(12346, CurrencyCode.INR.toMinorUnits(new BigDecimal("123.455")));
        assertEquals(new BigDecimal("499.00"), CurrencyCode.INR.toMajorUnits(49900));
    }
}
