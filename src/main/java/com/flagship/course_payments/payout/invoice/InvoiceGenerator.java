package com.flagship.course_payments.payout.invoice;

import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.payout.Payout;

/**
 * Renders the invoice sent to an educator once a payout is paid.
 */
public interface InvoiceGenerator {

    byte[] generateInvoice(Payout payout, Educator educator);

    /**
     * File name the rendered invoice is attached under.
     */
    String fileNameFor(Payout payout);

    String contentType();
}
