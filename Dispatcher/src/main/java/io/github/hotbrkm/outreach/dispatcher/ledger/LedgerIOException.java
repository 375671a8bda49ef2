package io.github.hotbrkm.outreach.dispatcher.ledger;

/**
 * The ledger could not be read or written.
 * <p>
 * This exception is fatal for the running cycle: sending more mail without a durable record is never allowed.
 */
public class LedgerIOException extends RuntimeException {
    public LedgerIOException(String message) {
        super(message);
    }

    public LedgerIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
