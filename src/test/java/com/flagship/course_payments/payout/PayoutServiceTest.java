package com.flagship.course_payments.payout;

import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.catalog.StudentDirectory;
import com.flagship.course_payments.exception.BusinessRuleViolationException;
import com.flagship.course_payments.exception.BusinessRuleViolationException.Rule;
import com.flagship.course_payments.exception.InvalidStateTransitionException;
import com.flagship.course_payments.exception.ResourceNotFoundException;
import com.flagship.course_payments.gateway.GatewayPayout;
import com.flagship.course_payments.gateway.GatewayPayoutRequest;
import com.flagship.course_payments.gateway.PaymentGatewayClient;
import com.flagship.course_payments.observability.CheckoutMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PayoutServiceTest {

    @Mock
    private PayoutPersistenceService persistenceService;

    @Mock
    private StudentDirectory studentDirectory;

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private CheckoutMetrics checkoutMetrics;

    @InjectMocks
    private PayoutService payoutService;

    private Payout pending;
    private Educator educator;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        educator = Educator.builder().id(UUID.randomUUID()).fullName("Meera Iyer")
                .email("meera@example.com").fundAccountId("fa_123").build();
        pending = Payout.builder()
                .id(UUID.randomUUID())
                .educatorId(educator.getId())
                .amount(100000)
                .currency("INR")
                .status(PayoutStatus.PENDING)
                .payoutCheckId("PC-2026-02-0001")
                .month(2)
                .year(2026)
                .build();
    }

    @Test
    @DisplayName("Initiation sends the payoutCheckId as reference and moves the payout to processing")
    void initiatesPayout() {
        printTestHeader("Initiate payout");
        Payout processing = pending.toBuilder().status(PayoutStatus.PROCESSING).gatewayPayoutId("pout_1").build();
        when(persistenceService.findById(pending.getId())).thenReturn(Optional.of(pending), Optional.of(processing));
        when(studentDirectory.findEducator(educator.getId())).thenReturn(Optional.of(educator));
        when(gatewayClient.createPayout(any(GatewayPayoutRequest.class)))
                .thenReturn(GatewayPayout.builder().id("pout_1").status("processing")
                        .referenceId("PC-2026-02-0001").build());
        when(persistenceService.markProcessing(pending, "pout_1", "Payout for 2/2026", "payout.initiated"))
                .thenReturn(true);

        Payout result = payoutService.initiatePayout(pending.getId());

        ArgumentCaptor<GatewayPayoutRequest> request = ArgumentCaptor.forClass(GatewayPayoutRequest.class);
        verify(gatewayClient).createPayout(request.capture());
        assertEquals("PC-2026-02-0001", request.getValue().getReferenceId());
        assertEquals("fa_123", request.getValue().getFundAccountId());
        assertEquals(100000, request.getValue().getAmount());
        assertEquals("PC-2026-02-0001-1", request.getValue().getIdempotencyKey());
        assertEquals(PayoutStatus.PROCESSING, result.getStatus());
        verify(checkoutMetrics).recordPayoutTransition("processing", true);
        printSuccess("Payout sent to the gateway");
    }

    @Test
    @DisplayName("Re-initiating a failed payout keeps the reference id but sends a new idempotency key")
    void retryAfterFailureUsesNewKey() {
        printTestHeader("Re-initiate failed payout");
        Payout failed = pending.toBuilder().status(PayoutStatus.FAILED).gatewayPayoutId("pout_1")
                .failureReason("Beneficiary bank offline").initiationAttempts(1).build();
        Payout processing = failed.toBuilder().status(PayoutStatus.PROCESSING).gatewayPayoutId("pout_2")
                .initiationAttempts(2).build();
        when(persistenceService.findById(failed.getId())).thenReturn(Optional.of(failed), Optional.of(processing));
        when(studentDirectory.findEducator(educator.getId())).thenReturn(Optional.of(educator));
        when(gatewayClient.createPayout(any(GatewayPayoutRequest.class)))
                .thenReturn(GatewayPayout.builder().id("pout_2").status("processing")
                        .referenceId("PC-2026-02-0001").build());
        when(persistenceService.markProcessing(failed, "pout_2", "Payout for 2/2026", "payout.initiated"))
                .thenReturn(true);

        Payout result = payoutService.initiatePayout(failed.getId());

        ArgumentCaptor<GatewayPayoutRequest> request = ArgumentCaptor.forClass(GatewayPayoutRequest.class);
        verify(gatewayClient).createPayout(request.capture());
        assertEquals("PC-2026-02-0001", request.getValue().getReferenceId());
        assertEquals("PC-2026-02-0001-2", request.getValue().getIdempotencyKey());
        assertEquals("pout_2", result.getGatewayPayoutId());
        printSuccess("Retry is not deduplicated against the failed transfer");
    }

    @Test
    @DisplayName("Paid payouts cannot be initiated again")
    void paidPayoutRefused() {
        Payout paid = pending.toBuilder().status(PayoutStatus.PAID).build();
        when(persistenceService.findById(paid.getId())).thenReturn(Optional.of(paid));

        assertThrows(InvalidStateTransitionException.class, () -> payoutService.initiatePayout(paid.getId()));
        verifyNoInteractions(gatewayClient);
    }

    @Test
    @DisplayName("Educator without a fund account is refused")
    void missingFundAccount() {
        Educator unlinked = Educator.builder().id(educator.getId()).fullName("Meera Iyer")
                .email("meera@example.com").build();
        when(persistenceService.findById(pending.getId())).thenReturn(Optional.of(pending));
        when(studentDirectory.findEducator(educator.getId())).thenReturn(Optional.of(unlinked));

        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
                () -> payoutService.initiatePayout(pending.getId()));

        assertEquals(Rule.MISSING_FUND_ACCOUNT, e.getRule());
        verifyNoInteractions(gatewayClient);
    }

    @Test
    @DisplayName("Unknown payout is not found")
    void unknownPayout() {
        UUID id = UUID.randomUUID();
        when(persistenceService.findById(id)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> payoutService.initiatePayout(id));
    }
}
