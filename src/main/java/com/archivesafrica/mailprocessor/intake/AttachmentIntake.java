package com.archivesafrica.mailprocessor.intake;

import com.archivesafrica.mailprocessor.exception.ProcessingException;
import com.archivesafrica.mailprocessor.registry.SenderRegistry;
import com.archivesafrica.mailprocessor.registry.SequenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes attachments from registered senders into the staging directory.
 * <p>
 * Each accepted attachment consumes one sequence number and is stored as
 * {@code <code>_<sequence>.xlsx}. Sequence numbers are persisted before the file is written
 * and are never given back, even if a later stage rejects the file.
 *
 * @invariant No file is written for a sender missing from the registry.
 * @invariant An existing staged file is never overwritten.
 */
public class AttachmentIntake {

    private static final Logger logger = LoggerFactory.getLogger(AttachmentIntake.class);

    public static final String STAGED_EXTENSION = ".xlsx";
    // Collisions only happen when the registry was rolled back by hand.
    private static final int MAX_NAME_ATTEMPTS = 100;

    private final SenderRegistry registry;
    private final SequenceStore sequenceStore;
    private final Path stagingDir;

    public AttachmentIntake(SenderRegistry registry, SequenceStore sequenceStore, Path stagingDir) {
        this.registry = registry;
        this.sequenceStore = sequenceStore;
        this.stagingDir = stagingDir;
    }

    /**
     * @return true if attachments from {@code sender} are accepted.
     */
    public boolean accepts(String sender) {
        return registry.isKnown(sender);
    }

    /**
     * Stages every attachment of a mailbox message.
     *
     * @param message the message; its sender must be registered for anything to be written
     * @return the staged files of this message
     */
    public IntakeResult stage(InboundMessage message) {
        if (!accepts(message.getSender())) {
            logger.info("Unknown sender: {} (message {})", message.getSender(), message.getReference());
            return new IntakeResult(Map.of(), message.getAttachments().size());
        }
        List<InboundAttachment> attachments = message.toAttachments();
        if (attachments.isEmpty()) {
            logger.debug("{}: No attachments found in message {}", message.getSender(), message.getReference());
        }
        return stage(attachments);
    }

    /**
     * Stages a batch of attachments.
     *
     * @param attachments sender/content pairs
     * @return staged path → sender, plus the number of rejected attachments
     * @post For each written file the owning sender's sequence has been durably advanced.
     */
    public IntakeResult stage(Iterable<InboundAttachment> attachments) {
        Map<Path, String> staged = new LinkedHashMap<>();
        int rejected = 0;

        for (InboundAttachment attachment : attachments) {
            String sender = attachment.getSender();
            if (!accepts(sender)) {
                logger.info("Unknown sender: {}", sender);
                rejected++;
                continue;
            }
            if (attachment.isEmpty()) {
                logger.info("{}: Skipping empty attachment", sender);
                rejected++;
                continue;
            }
            try {
                Path file = write(sender, attachment.getContent());
                staged.put(file, sender);
                logger.info("{}: Downloaded attachment {}", sender, file);
            } catch (IOException | ProcessingException e) {
                logger.error("{}: Failed to stage attachment: {}", sender, e.getMessage(), e);
                rejected++;
            }
        }

        logger.info("Downloaded {} attachment(s)", staged.size());
        return new IntakeResult(staged, rejected);
    }

    private Path write(String sender, byte[] content) throws IOException {
        Files.createDirectories(stagingDir);
        String code = registry.codeOf(sender);

        for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
            int sequence = sequenceStore.next(sender);
            Path target = stagingDir.resolve(fileName(code, sequence));
            try {
                Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return target;
            } catch (FileAlreadyExistsException e) {
                logger.warn("{}: {} already exists in staging, taking the next sequence number", sender, target.getFileName());
            }
        }
        throw new IOException("No free staging name for " + sender + " after " + MAX_NAME_ATTEMPTS + " attempts");
    }

    /**
     * @return the staged file name for a sender code and sequence number, e.g. {@code AX_1.xlsx}
     */
    public static String fileName(String code, int sequence) {
        return code + "_" + sequence + STAGED_EXTENSION;
    }
}
