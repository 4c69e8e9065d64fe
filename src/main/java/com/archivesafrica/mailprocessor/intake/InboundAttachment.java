package com.archivesafrica.mailprocessor.intake;

/**
 * Raw attachment bytes together with the address of the sender that delivered them.
 */
public final class InboundAttachment {

    private final String sender;
    private final byte[] content;

    public InboundAttachment(String sender, byte[] content) {
        this.sender = sender;
        this.content = content == null ? new byte[0] : content;
    }

    public String getSender() {
        return sender;
    }

    public byte[] getContent() {
        return content;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }
}
