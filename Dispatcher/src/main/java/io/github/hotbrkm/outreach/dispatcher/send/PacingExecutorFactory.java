package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.config.DispatchOptions;
import io.github.hotbrkm.outreach.dispatcher.ledger.Ledger;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * Holds the shared collaborators and creates a fresh {@link PacingExecutor} per cycle.
 */
@RequiredArgsConstructor
public class PacingExecutorFactory {

    private final DispatchOptions options;
    private final MessageComposer composer;
    private final MailTransport transport;
    private final Pacer pacer;
    private final Ledger ledger;
    private final Clock clock;
    private final DispatchMetricsRecorder metrics;

    public PacingExecutor create(String cycleId) {
        return new PacingExecutor(cycleId, options, composer, transport, pacer, new OutcomeRecorder(ledger, clock), metrics);
    }
}
