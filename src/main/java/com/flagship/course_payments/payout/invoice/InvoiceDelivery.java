package com.flagship.course_payments.payout.invoice;

import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.payout.Payout;

/**
 * Sends a rendered invoice to the educator.
 */
public interface InvoiceDelivery {

    /**
     * @throws org.springframework.mail.MailException if the message cannot be built or sent
     */
    void deliverInvoice(String to, Payout payout, Educator educator, byte[] invoice);
}
