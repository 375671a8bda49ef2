package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.config.DispatchOptions;
import io.github.hotbrkm.outreach.dispatcher.domain.QuotaBucket;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.quota.QuotaSnapshot;
import io.github.hotbrkm.outreach.dispatcher.quota.QuotaState;
import io.github.hotbrkm.outreach.dispatcher.send.Candidate;
import io.github.hotbrkm.outreach.dispatcher.send.PacingExecutor;
import io.github.hotbrkm.outreach.dispatcher.send.SendOutcome;
import io.github.hotbrkm.outreach.dispatcher.source.FillerTrafficSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One pass of the alternating scheduler: {@code INIT -> FILLER_BURST -> INTERLEAVE -> DONE}.
 * <p>
 * The filler burst spends up to {@code initialBurstSize} attempts on filler traffic. The interleave phase then
 * repeats one filler send followed by a sub-batch of outreach sends until the outreach quota is used up or no
 * candidates are left. Only successful sends consume quota; every attempt spends a burst or sub-batch slot.
 * Each burst, interleaved filler send and sub-batch is its own pacing batch.
 * <p>
 * A cycle instance runs once.
 */
@Slf4j
public class CampaignCycle {

    private final String cycleId;
    private final QuotaSnapshot quotaBefore;
    private final CandidateQueues queues;
    private final FillerTrafficSource fillerSource;
    private final PacingExecutor executor;
    private final DispatchOptions options;
    private final Clock clock;

    private final EnumMap<TrafficCategory, Integer> sent = new EnumMap<>(TrafficCategory.class);
    private final EnumMap<TrafficCategory, Integer> failed = new EnumMap<>(TrafficCategory.class);
    private final List<SendOutcome> outcomes = new ArrayList<>();

    private CycleState state = CycleState.INIT;
    private int outreachRemaining;
    private int fillerRemaining;
    private boolean fillerAvailable = true;

    public CampaignCycle(String cycleId, QuotaSnapshot quotaBefore, CandidateQueues queues, FillerTrafficSource fillerSource,
                         PacingExecutor executor, DispatchOptions options, Clock clock) {
        this.cycleId = cycleId;
        this.quotaBefore = Objects.requireNonNull(quotaBefore, "quotaBefore must not be null");
        this.queues = Objects.requireNonNull(queues, "queues must not be null");
        this.fillerSource = Objects.requireNonNull(fillerSource, "fillerSource must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.outreachRemaining = quotaBefore.outreach().remaining();
        this.fillerRemaining = quotaBefore.filler().remaining();
    }

    /**
     * Runs the cycle to {@link CycleState#DONE}.
     * <p>
     * An interrupt ends the cycle with {@link CycleEndReason#INTERRUPTED} and leaves the interrupt flag set.
     *
     * @throws io.github.hotbrkm.outreach.dispatcher.ledger.LedgerIOException if an outcome could not be recorded
     */
    public CycleSummary run() {
        if (state != CycleState.INIT) {
            throw new IllegalStateException("Cycle " + cycleId + " has already run");
        }
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        log.info("cycle={}, event=starting, outreachRemaining={}, fillerRemaining={}, fresh={}, followUps={}",
                cycleId, outreachRemaining, fillerRemaining, queues.freshSize(), queues.followUpSize());

        if (quotaBefore.allExhausted()) {
            return finish(startedAt, CycleEndReason.ALL_QUOTAS_REACHED);
        }

        CycleEndReason endReason;
        try {
            transition(CycleState.FILLER_BURST);
            runFillerBurst();
            transition(CycleState.INTERLEAVE);
            endReason = runInterleave();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("cycle={}, event=interrupted, state={}", cycleId, state);
            endReason = CycleEndReason.INTERRUPTED;
        }
        return finish(startedAt, endReason);
    }

    private void runFillerBurst() throws InterruptedException {
        int attempts = 0;
        while (fillerRemaining > 0 && attempts < options.initialBurstSize()) {
            checkInterrupted();
            Optional<Candidate> filler = nextFiller();
            if (filler.isEmpty()) {
                break;
            }
            send(filler.get(), attempts == 0);
            attempts++;
        }
        log.debug("cycle={}, event=burst-done, attempts={}, fillerRemaining={}", cycleId, attempts, fillerRemaining);
    }

    private CycleEndReason runInterleave() throws InterruptedException {
        while (true) {
            if (outreachRemaining <= 0) {
                return CycleEndReason.OUTREACH_QUOTA_REACHED;
            }
            if (queues.isEmpty()) {
                return CycleEndReason.CANDIDATES_EXHAUSTED;
            }

            if (fillerRemaining > 0) {
                checkInterrupted();
                Optional<Candidate> filler = nextFiller();
                if (filler.isPresent()) {
                    send(filler.get(), true);
                }
            }

            int batchAttempts = 0;
            while (batchAttempts < options.subBatchSize() && outreachRemaining > 0) {
                checkInterrupted();
                Optional<Candidate> next = queues.nextOutreach();
                if (next.isEmpty()) {
                    break;
                }
                send(next.get(), batchAttempts == 0);
                batchAttempts++;
            }
        }
    }

    private Optional<Candidate> nextFiller() {
        if (!fillerAvailable) {
            return Optional.empty();
        }
        Optional<Candidate> filler = fillerSource.nextFiller();
        if (filler.isEmpty()) {
            fillerAvailable = false;
            log.info("cycle={}, event=no-filler-available", cycleId);
        }
        return filler;
    }

    private void send(Candidate candidate, boolean startsBatch) throws InterruptedException {
        SendOutcome outcome = executor.send(candidate, startsBatch);
        outcomes.add(outcome);
        TrafficCategory category = candidate.category();
        if (outcome.isSent()) {
            sent.merge(category, 1, Integer::sum);
            if (category.bucket() == QuotaBucket.FILLER) {
                fillerRemaining--;
            } else {
                outreachRemaining--;
            }
        } else {
            failed.merge(category, 1, Integer::sum);
        }
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Cycle interrupted between sends");
        }
    }

    private void transition(CycleState next) {
        log.info("cycle={}, event=state, from={}, to={}", cycleId, state, next);
        state = next;
    }

    private CycleSummary finish(OffsetDateTime startedAt, CycleEndReason endReason) {
        transition(CycleState.DONE);
        CycleSummary summary = CycleSummary.builder()
                .cycleId(cycleId)
                .startedAt(startedAt)
                .finishedAt(OffsetDateTime.now(clock))
                .finalState(state)
                .endReason(endReason)
                .quotaBefore(quotaBefore)
                .quotaAfter(quotaAfter())
                .sent(sent)
                .failed(failed)
                .outcomes(outcomes)
                .remainingFresh(queues.freshSize())
                .remainingFollowUps(queues.followUpSize())
                .build();
        log.info("cycle={}, event=completed, reason={}, sent={}, failed={}, outreachRemaining={}, fillerRemaining={}, "
                        + "unsentFresh={}, unsentFollowUps={}",
                cycleId, endReason, summary.sent(), summary.failed(), outreachRemaining, fillerRemaining,
                summary.remainingFresh(), summary.remainingFollowUps());
        return summary;
    }

    private QuotaSnapshot quotaAfter() {
        return new QuotaSnapshot(quotaBefore.date(),
                consumedAfter(quotaBefore.outreach()),
                consumedAfter(quotaBefore.filler()));
    }

    private QuotaState consumedAfter(QuotaState before) {
        int sentInBucket = sent.entrySet().stream()
                .filter(entry -> entry.getKey().bucket() == before.bucket())
                .mapToInt(entry -> entry.getValue())
                .sum();
        return new QuotaState(before.bucket(), before.ceiling(), before.consumed() + sentInBucket);
    }
}
