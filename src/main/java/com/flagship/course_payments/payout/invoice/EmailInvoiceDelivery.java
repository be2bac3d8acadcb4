package com.flagship.course_payments.payout.invoice;

import com.flagship.course_payments.catalog.Educator;
import com.flagship.course_payments.payout.Payout;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Mails the invoice as an attachment through the configured SMTP server.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailInvoiceDelivery implements InvoiceDelivery {

    private final JavaMailSender mailSender;
    private final InvoiceGenerator invoiceGenerator;

    @Value("${invoice.mail.from:payouts@localhost}")
    private String fromAddress;

    @Override
    public void deliverInvoice(String to, Payout payout, Educator educator, byte[] invoice) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(fromAddress);
            helper.setTo(to);
            helper.setSubject("Payout Invoice - " + payout.getPayoutCheckId());
            helper.setText("Hi " + educator.getFullName() + ",\n\n"
                    + "Your payout for " + payout.getMonth() + "/" + payout.getYear()
                    + " has been processed. The invoice is attached.\n");
            helper.addAttachment(invoiceGenerator.fileNameFor(payout), new ByteArrayResource(invoice),
                    invoiceGenerator.contentType());
        } catch (MessagingException e) {
            throw new MailPreparationException("Failed to build invoice email for " + payout.getPayoutCheckId(), e);
        }

        mailSender.send(message);
        log.info("Invoice emailed: payoutCheckId={}, to={}", payout.getPayoutCheckId(), to);
    }
}
