package io.github.hotbrkm.outreach.dispatcher.ledger;

import java.util.stream.Stream;

/**
 * Append-only, durable history of send attempts. The only source of truth for eligibility and quota.
 */
public interface Ledger {

    /**
     * Persists one entry. Returns only after the entry is durable.
     *
     * @throws LedgerIOException if the entry could not be written
     */
    void append(LedgerEntry entry);

    /**
     * Streams every entry in append order. Each call starts from the beginning.
     * The caller must close the returned stream.
     *
     * @throws LedgerIOException if the history cannot be read
     */
    Stream<LedgerEntry> scan();

    /**
     * Acquires the single-writer advisory lock.
     *
     * @throws io.github.hotbrkm.outreach.dispatcher.config.CampaignLockException if another dispatcher holds it
     */
    LedgerLock lock();
}
