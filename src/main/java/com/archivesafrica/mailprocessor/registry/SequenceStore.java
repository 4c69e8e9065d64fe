package com.archivesafrica.mailprocessor.registry;

/**
 * Hands out per-sender sequence numbers for naming staged attachments.
 *
 * @invariant For a given sender the returned values strictly increase, across runs too.
 */
public interface SequenceStore {

    /**
     * Advances the counter of {@code sender} and persists it.
     *
     * @param sender the sender address
     * @return the previous value plus one, or 1 if the sender has no counter yet
     * @post The returned value is durably stored before this method returns.
     * @throws com.archivesafrica.mailprocessor.exception.ProcessingException if the new value
     *         cannot be persisted; the counter is left unchanged in that case.
     */
    int next(String sender);
}
