package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.config.CampaignConfigException;
import io.github.hotbrkm.outreach.dispatcher.config.DispatchOptions;
import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.eligibility.EligibilityCalculator;
import io.github.hotbrkm.outreach.dispatcher.eligibility.LedgerHistory;
import io.github.hotbrkm.outreach.dispatcher.ledger.Ledger;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerLock;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerStatistics;
import io.github.hotbrkm.outreach.dispatcher.quota.QuotaSnapshot;
import io.github.hotbrkm.outreach.dispatcher.quota.QuotaTracker;
import io.github.hotbrkm.outreach.dispatcher.send.DeliveryResult;
import io.github.hotbrkm.outreach.dispatcher.send.MailTransport;
import io.github.hotbrkm.outreach.dispatcher.send.PacingExecutorFactory;
import io.github.hotbrkm.outreach.dispatcher.source.FillerTrafficSource;
import io.github.hotbrkm.outreach.dispatcher.source.RecipientSource;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the engine. Runs one dispatch cycle per call under the ledger lock.
 * <p>
 * Runs in order: lock → quota snapshot → transport check → load recipients and history → cycle → statistics.
 */
@Slf4j
public class CampaignDispatcher {

    private static final DateTimeFormatter CYCLE_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final DispatchOptions options;
    private final Ledger ledger;
    private final RecipientSource recipientSource;
    private final FillerTrafficSource fillerSource;
    private final MailTransport transport;
    private final PacingExecutorFactory executorFactory;
    private final Clock clock;
    private final boolean verifyBeforeCycle;
    private final QuotaTracker quotaTracker;
    private final CandidateQueueBuilder queueBuilder;

    @Builder
    public CampaignDispatcher(DispatchOptions options, Ledger ledger, RecipientSource recipientSource,
                              FillerTrafficSource fillerSource, MailTransport transport,
                              PacingExecutorFactory executorFactory, Clock clock, boolean verifyBeforeCycle) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.recipientSource = Objects.requireNonNull(recipientSource, "recipientSource must not be null");
        this.fillerSource = Objects.requireNonNull(fillerSource, "fillerSource must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.verifyBeforeCycle = verifyBeforeCycle;
        this.quotaTracker = new QuotaTracker(ledger, clock, options);
        this.queueBuilder = new CandidateQueueBuilder(new EligibilityCalculator(options.followUpPolicy()));
    }

    /**
     * Runs one cycle.
     *
     * @throws io.github.hotbrkm.outreach.dispatcher.config.CampaignLockException if another dispatcher holds the ledger
     * @throws CampaignConfigException                                            if the transport check fails
     * @throws io.github.hotbrkm.outreach.dispatcher.ledger.LedgerIOException     if the ledger cannot be read or written
     */
    public CycleSummary runCycle() {
        String cycleId = OffsetDateTime.now(clock).format(CYCLE_ID_FORMAT);
        log.info("cycle={}, event=dispatch-starting", cycleId);
        try (LedgerLock ignored = ledger.lock()) {
            QuotaSnapshot quota = quotaTracker.snapshot();
            if (quota.allExhausted()) {
                log.info("cycle={}, event=skipped, reason=all-quotas-reached", cycleId);
                return idleCycle(cycleId, quota);
            }

            if (verifyBeforeCycle) {
                DeliveryResult check = transport.verifyConnection();
                if (!check.success()) {
                    throw new CampaignConfigException("Mail transport check failed: " + check.reason());
                }
            }

            List<Recipient> recipients = recipientSource.loadRecipients();
            LedgerHistory history = LedgerHistory.load(ledger);
            CandidateQueues queues = queueBuilder.build(recipients, history, OffsetDateTime.now(clock));

            CampaignCycle cycle = new CampaignCycle(cycleId, quota, queues, fillerSource,
                    executorFactory.create(cycleId), options, clock);
            CycleSummary summary = cycle.run();
            logStatistics(cycleId);
            return summary;
        }
    }

    private CycleSummary idleCycle(String cycleId, QuotaSnapshot quota) {
        return new CampaignCycle(cycleId, quota, CandidateQueues.empty(), fillerSource,
                executorFactory.create(cycleId), options, clock).run();
    }

    private void logStatistics(String cycleId) {
        LedgerStatistics statistics = LedgerStatistics.of(ledger);
        log.info("cycle={}, event=ledger-statistics, attempts={}, sent={}, failed={}, successRate={}",
                cycleId, statistics.totalAttempts(), statistics.sentByCategory(), statistics.failed(),
                String.format("%.1f%%", statistics.successRate()));
    }
}
