package com.archivesafrica.mailprocessor.mail;

import com.archivesafrica.mailprocessor.intake.InboundMessage;
import jakarta.mail.MessagingException;

/**
 * Source of unread messages.
 */
public interface MailboxClient {

    /**
     * Callback for one unread message.
     */
    @FunctionalInterface
    interface MessageHandler {
        /**
         * @return true if the message was consumed and should be marked read
         */
        boolean handle(InboundMessage message);
    }

    /**
     * Hands every unread message to {@code handler}, in mailbox order, and marks the
     * consumed ones read.
     *
     * @return the number of unread messages seen
     * @throws MessagingException if the mailbox cannot be reached or opened
     */
    int poll(MessageHandler handler) throws MessagingException;
}
