package com.flagship.course_payments.reporting;

import com.flagship.course_payments.catalog.ProductType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Validated
public class ReportController {

    private final RevenueReportService revenueReportService;

    @GetMapping("/revenue")
    public ResponseEntity<RevenueReport> revenue(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(revenueReportService.summarize(from, to));
    }

    @GetMapping("/revenue/summary")
    public ResponseEntity<RevenueSummary> revenueSummary(
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(name = "productType", required = false) String productType) {
        return ResponseEntity.ok(revenueReportService.summary(from, to, productTypeOrNull(productType)));
    }

    @GetMapping("/revenue/monthly")
    public ResponseEntity<List<MonthlyRevenue>> revenueByMonth(
            @RequestParam(name = "months", required = false) Integer months,
            @RequestParam(name = "productType", required = false) String productType) {
        return ResponseEntity.ok(revenueReportService.byMonth(months, productTypeOrNull(productType)));
    }

    @GetMapping("/revenue/transactions")
    public ResponseEntity<RevenueTransactionPage> revenueTransactions(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "productType", required = false) String productType,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(name = "size", defaultValue = "20") @Min(1) @Max(100) int size) {

        TransactionQuery query = TransactionQuery.builder()
                .status(status)
                .productType(productTypeOrNull(productType))
                .from(from)
                .to(to)
                .search(search)
                .build();

        PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(revenueReportService.transactions(query, pageable));
    }

    private static ProductType productTypeOrNull(String wireName) {
        return wireName != null && !wireName.isBlank() ? ProductType.fromWireName(wireName) : null;
    }
}
