package com.archivesafrica.mailprocessor.intake;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One unread mailbox message reduced to what intake needs: the sender address (from the
 * Return-Path header, angle brackets stripped) and the decoded attachment payloads.
 */
public final class InboundMessage {

    private final String reference;
    private final String sender;
    private final List<byte[]> attachments;

    /**
     * @param reference mailbox-specific identifier used in log lines (message number, Message-ID)
     * @param sender the sender address, may be null if the message carried none
     * @param attachments decoded payloads of the attachment parts, in message order
     */
    public InboundMessage(String reference, String sender, List<byte[]> attachments) {
        this.reference = reference;
        this.sender = sender;
        this.attachments = Collections.unmodifiableList(new ArrayList<>(attachments));
    }

    public String getReference() {
        return reference;
    }

    public String getSender() {
        return sender;
    }

    public List<byte[]> getAttachments() {
        return attachments;
    }

    public List<InboundAttachment> toAttachments() {
        List<InboundAttachment> result = new ArrayList<>(attachments.size());
        for (byte[] content : attachments) {
            result.add(new InboundAttachment(sender, content));
        }
        return result;
    }
}
