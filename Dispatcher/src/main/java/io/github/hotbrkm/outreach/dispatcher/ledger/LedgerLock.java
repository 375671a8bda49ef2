package io.github.hotbrkm.outreach.dispatcher.ledger;

/**
 * Held advisory lock on a ledger. Released by {@link #close()}.
 */
@FunctionalInterface
public interface LedgerLock extends AutoCloseable {

    @Override
    void close();
}
