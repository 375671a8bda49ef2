package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.config.DispatchOptions;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerIOException;
import io.github.hotbrkm.outreach.dispatcher.ledger.SendStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Sends candidates one at a time with pacing and bounded retries.
 * <p>
 * One executor serves one cycle. The cycle groups sends into batches (the filler burst, a single interleaved
 * filler send, an outreach sub-batch). Between two sends of the same batch the executor waits for the pacing
 * delay of the earlier send's category; no delay follows the last send of a batch.
 * Every call to {@link #send(Candidate, boolean)} appends exactly one ledger entry before returning.
 * <p>
 * In the Schedule layer, create instances through {@link PacingExecutorFactory}.
 */
@Slf4j
public class PacingExecutor {

    private final String cycleId;
    private final DispatchOptions options;
    private final MessageComposer composer;
    private final MailTransport transport;
    private final Pacer pacer;
    private final OutcomeRecorder recorder;
    private final DispatchMetricsRecorder metrics;

    private TrafficCategory previousCategory;

    public PacingExecutor(String cycleId, DispatchOptions options, MessageComposer composer, MailTransport transport,
                          Pacer pacer, OutcomeRecorder recorder, DispatchMetricsRecorder metrics) {
        this.cycleId = cycleId;
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.composer = Objects.requireNonNull(composer, "composer must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.pacer = Objects.requireNonNull(pacer, "pacer must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Paces, composes, delivers with retries and records the outcome.
     *
     * @param startsBatch {@code true} for the first send of a batch, which is never preceded by a pacing delay
     * @throws InterruptedException if interrupted while waiting. An interrupt during the pacing delay records
     *                              nothing; an interrupt between retries records the candidate as FAILED first
     * @throws LedgerIOException    if the outcome could not be recorded
     */
    public SendOutcome send(Candidate candidate, boolean startsBatch) throws InterruptedException {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (!startsBatch) {
            awaitPacing();
        }
        previousCategory = candidate.category();

        ComposedMessage message;
        try {
            message = composer.compose(candidate.recipient(), candidate.category(), candidate.sequence());
        } catch (RuntimeException e) {
            log.warn("cycle={}, event=compose-failed, recipient={}, category={}, reason={}",
                    cycleId, candidate.key(), candidate.category().code(), e.getMessage());
            return record(SendOutcome.failed(candidate, 0, "compose failed: " + e.getMessage()), null);
        }

        RetryPolicy retryPolicy = options.retryPolicy();
        int attempts = 0;
        DeliveryResult result = null;
        while (retryPolicy.canAttempt(attempts)) {
            if (attempts > 0) {
                log.info("cycle={}, event=retry-wait, recipient={}, attempt={}, wait={}",
                        cycleId, candidate.key(), attempts + 1, retryPolicy.retryWait());
                try {
                    pacer.await(retryPolicy.retryWait());
                } catch (InterruptedException e) {
                    record(SendOutcome.failed(candidate, attempts, "interrupted during retry wait"), message);
                    throw e;
                }
            }
            attempts++;
            result = deliverOnce(candidate, message);
            metrics.recordAttempt(candidate.category(), result);
            if (result.success()) {
                break;
            }
            log.warn("cycle={}, event=attempt-failed, recipient={}, category={}, attempt={}/{}, reason={}",
                    cycleId, candidate.key(), candidate.category().code(), attempts, retryPolicy.maxAttempts(),
                    result.reason());
        }

        if (result != null && result.success()) {
            return record(SendOutcome.sent(candidate, attempts), message);
        }
        String reason = result == null ? "no attempt made" : result.reason();
        return record(SendOutcome.failed(candidate, attempts, reason), message);
    }

    private void awaitPacing() throws InterruptedException {
        if (previousCategory == null) {
            return;
        }
        Duration waited = pacer.pause(options.delayRange(previousCategory));
        metrics.recordPacingDelay(previousCategory, waited);
        log.debug("cycle={}, event=paced, after={}, waited={}", cycleId, previousCategory.code(), waited);
    }

    private DeliveryResult deliverOnce(Candidate candidate, ComposedMessage message) {
        try {
            DeliveryResult result = transport.deliver(options.fromAddress(), candidate.key(), message.subject(), message.body());
            return result == null ? DeliveryResult.failure("transport returned no result") : result;
        } catch (RuntimeException e) {
            return DeliveryResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private SendOutcome record(SendOutcome outcome, ComposedMessage message) {
        try {
            recorder.record(outcome.candidate(), outcome.status(), message);
        } catch (LedgerIOException e) {
            log.error("cycle={}, event=ledger-failed, recipient={}, status={}",
                    cycleId, outcome.candidate().key(), outcome.status(), e);
            throw e;
        }
        metrics.recordOutcome(outcome.candidate().category(), outcome.status());
        if (outcome.status() == SendStatus.SENT) {
            log.info("cycle={}, event=sent, recipient={}, category={}, sequence={}, attempts={}",
                    cycleId, outcome.candidate().key(), outcome.candidate().category().code(),
                    outcome.candidate().sequence(), outcome.attempts());
        } else {
            log.warn("cycle={}, event=failed, recipient={}, category={}, attempts={}, reason={}",
                    cycleId, outcome.candidate().key(), outcome.candidate().category().code(),
                    outcome.attempts(), outcome.failureReason());
        }
        return outcome;
    }
}
