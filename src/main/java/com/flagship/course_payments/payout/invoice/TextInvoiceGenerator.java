package com.flagship.course_payments.payout.invoice;

import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.payment.CurrencyCode;
import com.flagship.course_payments.payout.Payout;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Plain-text payout invoice.
 */
@Component
public class TextInvoiceGenerator implements InvoiceGenerator {

    private static final String RULE = "----------------------------------------";

    @Override
    public byte[] generateInvoice(Payout payout, Educator educator) {
        StringBuilder invoice = new StringBuilder()
                .append("PAYOUT INVOICE\n")
                .append(RULE).append('\n')
                .append("Invoice #: INV-").append(payout.getPayoutCheckId()).append('\n')
                .append("Educator: ").append(educator.getFullName()).append('\n')
                .append("Email: ").append(educator.getEmail()).append('\n')
                .append("Reference: ").append(payout.getPayoutCheckId()).append('\n')
                .append("Status: ").append(payout.getStatus().wireName()).append('\n')
                .append("Period: ").append(period(payout)).append('\n')
                .append(RULE).append('\n')
                .append("Gross revenue:  ").append(money(payout, payout.getGrossAmount())).append('\n')
                .append("Commission:    -").append(money(payout, payout.getCommissionAmount())).append('\n')
                .append("Net payout:     ").append(money(payout, payout.getAmount())).append('\n')
                .append(RULE).append('\n');

        if (payout.getGatewayPayoutId() != null) {
            invoice.append("Gateway payout id: ").append(payout.getGatewayPayoutId()).append('\n');
        }
        return invoice.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String fileNameFor(Payout payout) {
        return payout.getPayoutCheckId() + "-invoice.txt";
    }

    @Override
    public String contentType() {
        return "text/plain";
    }

    private static String period(Payout payout) {
        return Month.of(payout.getMonth()).getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + payout.getYear();
    }

    private static String money(Payout payout, long minorUnits) {
        BigDecimal major = CurrencyCode.valueOf(payout.getCurrency()).toMajorUnits(minorUnits);
        return payout.getCurrency() + " " + major.toPlainString();
    }
}
