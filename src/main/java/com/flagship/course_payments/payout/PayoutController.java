package com.flagship.course_payments.payout;

import com.flagship.course_payments.payout.dto.PayoutPageResponse;
import com.flagship.course_payments.payout.dto.PayoutResponse;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/payouts")
@RequiredArgsConstructor
@Validated
@Slf4j
public class PayoutController {

    private final PayoutService payoutService;

    @GetMapping
    public ResponseEntity<PayoutPageResponse> listPayouts(
            @RequestParam(name = "educatorId", required = false) UUID educatorId,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "month", required = false) @Min(1) @Max(12) Integer month,
            @RequestParam(name = "year", required = false) Integer year,
            @RequestParam(name = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(name = "size", defaultValue = "20") @Min(1) @Max(100) int size) {

        PayoutFilter filter = PayoutFilter.builder()
                .educatorId(educatorId)
                .status(status != null ? PayoutStatus.fromWireName(status) : null)
                .month(month)
                .year(year)
                .build();

        PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(PayoutPageResponse.from(payoutService.listPayouts(filter, pageable)));
    }

    @PostMapping("/{payoutId}/initiate")
    public ResponseEntity<PayoutResponse> initiatePayout(@PathVariable("payoutId") UUID payoutId) {
        log.info("Received payout initiation: payoutId={}", payoutId);
        return ResponseEntity.ok(PayoutResponse.from(payoutService.initiatePayout(payoutId)));
    }
}
