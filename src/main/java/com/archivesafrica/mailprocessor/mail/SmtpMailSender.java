package com.archivesafrica.mailprocessor.mail;

import com.archivesafrica.mailprocessor.config.ProcessorSettings;
import com.archivesafrica.mailprocessor.exception.ConfigurationException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;

/**
 * {@link MailSender} over SMTP using Jakarta Mail.
 */
public class SmtpMailSender implements MailSender {

    private static final Logger logger = LoggerFactory.getLogger(SmtpMailSender.class);

    private final ProcessorSettings.Smtp smtp;
    private final Session session;

    /**
     * @throws ConfigurationException if no SMTP host is configured
     */
    public SmtpMailSender(ProcessorSettings.Smtp smtp) {
        if (smtp == null || !smtp.isComplete()) {
            throw new ConfigurationException("Invalid SMTP configuration, check the 'smtp' section of the settings.");
        }
        this.smtp = smtp;
        this.session = Session.getInstance(buildProperties());
    }

    private Properties buildProperties() {
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", smtp.host);
        props.put("mail.smtp.port", String.valueOf(smtp.port));
        props.put("mail.smtp.auth", String.valueOf(smtp.hasCredentials()));
        props.put("mail.smtp.starttls.enable", String.valueOf(smtp.starttls));
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "20000");
        return props;
    }

    @Override
    public void send(String to, String subject, String body) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        String from = smtp.from != null && !smtp.from.isBlank() ? smtp.from : smtp.username;
        if (from != null && !from.isBlank()) {
            message.setFrom(new InternetAddress(from));
        }
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
        message.setSubject(subject, StandardCharsets.UTF_8.name());
        message.setText(body, StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());

        logger.debug("Sending '{}' to {} via {}:{}", subject, to, smtp.host, smtp.port);
        if (smtp.hasCredentials()) {
            Transport.send(message, smtp.username, smtp.password);
        } else {
            Transport.send(message);
        }
    }
}
