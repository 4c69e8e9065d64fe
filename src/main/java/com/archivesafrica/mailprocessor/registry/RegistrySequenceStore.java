package com.archivesafrica.mailprocessor.registry;

import com.archivesafrica.mailprocessor.exception.ProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@link SequenceStore} that keeps its counters in the {@link SenderRegistry} file.
 */
public class RegistrySequenceStore implements SequenceStore {

    private static final Logger logger = LoggerFactory.getLogger(RegistrySequenceStore.class);

    private final SenderRegistry registry;

    public RegistrySequenceStore(SenderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public int next(String sender) {
        Integer previous = registry.sequenceOf(sender);
        int next = (previous == null ? 0 : previous) + 1;

        registry.setSequence(sender, next);
        try {
            registry.save();
        } catch (IOException e) {
            // Roll back so the in-memory state never runs ahead of the file.
            registry.setSequence(sender, previous);
            throw new ProcessingException("Cannot persist sequence " + next + " for " + sender, e);
        }
        logger.debug("{}: sequence advanced to {}", sender, next);
        return next;
    }
}
