package com.archivesafrica.mailprocessor.mail;

import com.archivesafrica.mailprocessor.config.ProcessorSettings;
import com.archivesafrica.mailprocessor.exception.ConfigurationException;
import com.archivesafrica.mailprocessor.intake.InboundMessage;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.FlagTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * {@link MailboxClient} reading unread messages from an IMAP folder with Jakarta Mail.
 * <p>
 * Messages are fetched without touching their {@code \Seen} flag; a message is only flagged
 * read once the handler has consumed it. Messages from unknown senders therefore stay unread.
 * <p>
 * Port 993 enables implicit SSL (imaps).
 */
public class ImapMailboxClient implements MailboxClient {

    private static final Logger logger = LoggerFactory.getLogger(ImapMailboxClient.class);

    private final ProcessorSettings.Mailbox mailbox;

    /**
     * @throws ConfigurationException if host, username or password is missing
     */
    public ImapMailboxClient(ProcessorSettings.Mailbox mailbox) {
        if (mailbox == null || !mailbox.isComplete()) {
            throw new ConfigurationException("Invalid mailbox configuration, check the 'mailbox' section of the settings.");
        }
        this.mailbox = mailbox;
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     */
    private Properties buildProperties() {
        Properties props = new Properties();
        boolean ssl = mailbox.port == 993;
        String protocol = ssl ? "imaps" : "imap";

        props.put("mail.store.protocol", protocol);
        props.put("mail." + protocol + ".host", mailbox.host);
        props.put("mail." + protocol + ".port", String.valueOf(mailbox.port));
        props.put("mail." + protocol + ".ssl.enable", String.valueOf(ssl));
        // Fetch with BODY.PEEK so reading content does not flag the message.
        props.put("mail." + protocol + ".peek", "true");
        props.put("mail." + protocol + ".connectiontimeout", "10000");
        props.put("mail." + protocol + ".timeout", "20000");
        return props;
    }

    @Override
    public int poll(MessageHandler handler) throws MessagingException {
        Properties props = buildProperties();
        Session session = Session.getInstance(props);
        String protocol = props.getProperty("mail.store.protocol");

        logger.debug("Connecting to {}://{}:{} ...", protocol, mailbox.host, mailbox.port);
        Store store = session.getStore(protocol);
        try {
            store.connect(mailbox.host, mailbox.port, mailbox.username, mailbox.password);
        } catch (AuthenticationFailedException e) {
            throw new MessagingException("IMAP authentication failed for user '" + mailbox.username + "'", e);
        }
        logger.debug("Logged in as {}", mailbox.username);

        Folder folder = null;
        try {
            folder = store.getFolder(mailbox.folder);
            if (folder == null || !folder.exists()) {
                throw new MessagingException("Folder '" + mailbox.folder + "' does not exist on " + mailbox.host);
            }
            folder.open(Folder.READ_WRITE);

            Message[] unread = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
            logger.info("Found {} unread message(s) in {}", unread.length, mailbox.folder);

            for (Message message : unread) {
                handle(message, handler);
            }
            return unread.length;
        } finally {
            close(folder, store);
        }
    }

    private void handle(Message message, MessageHandler handler) {
        String reference = "#" + message.getMessageNumber();
        try {
            InboundMessage inbound = toInbound(message, reference);
            logger.debug("Message {} from: {}", reference, inbound.getSender());
            if (handler.handle(inbound)) {
                message.setFlag(Flags.Flag.SEEN, true);
            }
        } catch (MessagingException | IOException e) {
            logger.error("Failed to read message {}: {}", reference, e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.error("Failed to handle message {}: {}", reference, e.getMessage(), e);
        }
    }

    /**
     * Reduces a message to its sender and attachment payloads.
     */
    static InboundMessage toInbound(Message message, String reference) throws MessagingException, IOException {
        List<byte[]> attachments = new ArrayList<>();
        collectAttachments(message, attachments);
        return new InboundMessage(reference, senderOf(message), attachments);
    }

    /**
     * Sender address from the Return-Path header with angle brackets stripped, falling back
     * to the first From address.
     *
     * @return the address, or null if the message names none
     */
    static String senderOf(Message message) throws MessagingException {
        String[] returnPath = message.getHeader("Return-Path");
        if (returnPath != null && returnPath.length > 0) {
            String address = returnPath[0].replaceAll("[<>]", "").trim();
            if (!address.isEmpty()) {
                return address;
            }
        }
        Address[] from = message.getFrom();
        if (from != null && from.length > 0) {
            return from[0] instanceof InternetAddress ? ((InternetAddress) from[0]).getAddress() : from[0].toString();
        }
        return null;
    }

    /**
     * Walks the part tree and collects the decoded payload of every leaf part that carries
     * a Content-Disposition.
     */
    static void collectAttachments(Part part, List<byte[]> attachments) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                collectAttachments(multipart.getBodyPart(i), attachments);
            }
            return;
        }
        if (part.getDisposition() == null) {
            return;
        }
        try (InputStream in = part.getInputStream()) {
            attachments.add(in.readAllBytes());
        }
    }

    private void close(Folder folder, Store store) {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
        } catch (MessagingException e) {
            logger.warn("Error closing folder: {}", e.getMessage());
        }
        try {
            if (store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            logger.warn("Error closing IMAP connection: {}", e.getMessage());
        }
    }
}
