package com.archivesafrica.mailprocessor.mail;

import jakarta.mail.MessagingException;

/**
 * Outbound mail transport used for the automated replies.
 */
public interface MailSender {

    /**
     * Sends a plain text message.
     *
     * @param to recipient address
     * @param subject subject line
     * @param body message text
     * @throws MessagingException if the message cannot be built or handed to the relay
     */
    void send(String to, String subject, String body) throws MessagingException;
}
