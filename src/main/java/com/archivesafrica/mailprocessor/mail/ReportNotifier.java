package com.archivesafrica.mailprocessor.mail;

import com.archivesafrica.mailprocessor.exception.ConfigurationException;
import com.archivesafrica.mailprocessor.registry.SenderRegistry;
import jakarta.mail.MessagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Sends the automated replies of the pipeline.
 * <p>
 * Senders get a failure report listing missing fields, or a success report; both use the
 * sender's preferred language and fall back to {@value SenderRegistry#DEFAULT_LANGUAGE}. The
 * report address gets a notice for every new collection document.
 * <p>
 * Delivery problems are logged and never thrown: the submitter never sees transport errors,
 * and a failed reply must not undo the routing of a file.
 */
public class ReportNotifier {

    private static final Logger logger = LoggerFactory.getLogger(ReportNotifier.class);

    public static final String FAILURE_SUBJECT = "Missing fields";
    public static final String SUCCESS_SUBJECT = "Thank you for your email";
    public static final String ADMIN_SUBJECT = "New files added";

    private final MailSender sender;
    private final ReportTemplates templates;
    private final SenderRegistry registry;
    private final String reportAddress;

    public ReportNotifier(MailSender sender, ReportTemplates templates, SenderRegistry registry, String reportAddress) {
        this.sender = sender;
        this.templates = templates;
        this.registry = registry;
        this.reportAddress = reportAddress;
    }

    /**
     * Tells {@code to} which required fields were empty.
     */
    public void sendFailureReport(String to, List<String> missingFields) {
        String language = registry.languageOf(to);
        String message = templates.load(ReportTemplates.Kind.FAILURE, language).orElse(FAILURE_SUBJECT);
        logger.info("Sending failure report to: {}", to);
        deliver(to, FAILURE_SUBJECT, message + "\n" + missingFields);
    }

    /**
     * Thanks {@code to} and notifies the report address about {@code document}.
     */
    public void sendSuccessReport(String to, Path document) {
        String language = registry.languageOf(to);
        String message = templates.load(ReportTemplates.Kind.SUCCESS, language).orElse(SUCCESS_SUBJECT);
        logger.info("Sending success report to: {}", to);
        deliver(to, SUCCESS_SUBJECT, message);

        try {
            sendAdminNotice(to, document);
        } catch (ConfigurationException e) {
            logger.error("Missing email address to send success reports: {}", e.getMessage());
        }
    }

    /**
     * @throws ConfigurationException if no report address is configured
     */
    void sendAdminNotice(String submitter, Path document) {
        if (reportAddress == null || reportAddress.isBlank()) {
            throw new ConfigurationException("reports.email is not set");
        }
        deliver(reportAddress, ADMIN_SUBJECT, "From " + submitter + ", " + document);
    }

    private void deliver(String to, String subject, String body) {
        try {
            sender.send(to, subject, body);
        } catch (MessagingException | RuntimeException e) {
            logger.error("Failed to send '{}' to {}: {}", subject, to, e.getMessage(), e);
        }
    }
}
