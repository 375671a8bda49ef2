package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.config.DispatchOptions;
import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerEntry;
import io.github.hotbrkm.outreach.dispatcher.ledger.SendStatus;
import io.github.hotbrkm.outreach.dispatcher.quota.QuotaSnapshot;
import io.github.hotbrkm.outreach.dispatcher.quota.QuotaTracker;
import io.github.hotbrkm.outreach.dispatcher.send.Candidate;
import io.github.hotbrkm.outreach.dispatcher.send.ComposedMessage;
import io.github.hotbrkm.outreach.dispatcher.send.DelayRange;
import io.github.hotbrkm.outreach.dispatcher.send.DeliveryResult;
import io.github.hotbrkm.outreach.dispatcher.send.DispatchMetricsRecorder;
import io.github.hotbrkm.outreach.dispatcher.send.MailTransport;
import io.github.hotbrkm.outreach.dispatcher.send.MessageComposer;
import io.github.hotbrkm.outreach.dispatcher.send.PacingExecutorFactory;
import io.github.hotbrkm.outreach.dispatcher.send.SendOutcome;
import io.github.hotbrkm.outreach.dispatcher.source.ConfiguredFillerTrafficSource;
import io.github.hotbrkm.outreach.dispatcher.source.FillerTrafficSource;
import io.github.hotbrkm.outreach.dispatcher.support.InMemoryLedger;
import io.github.hotbrkm.outreach.dispatcher.support.RecordingPacer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static io.github.hotbrkm.outreach.dispatcher.support.TestFixtures.fixedClock;
import static io.github.hotbrkm.outreach.dispatcher.support.TestFixtures.defaultOptions;
import static io.github.hotbrkm.outreach.dispatcher.support.TestFixtures.now;
import static io.github.hotbrkm.outreach.dispatcher.support.TestFixtures.recipient;
import static io.github.hotbrkm.outreach.dispatcher.support.TestFixtures.recipients;
import static io.github.hotbrkm.outreach.dispatcher.support.TestFixtures.sent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("CampaignCycle test")
class CampaignCycleTest {

    private static final TrafficCategory F = TrafficCategory.FILLER;
    private static final TrafficCategory O = TrafficCategory.FIRST_TOUCH;

    private MailTransport transport;
    private MessageComposer composer;
    private RecordingPacer pacer;
    private FillerTrafficSource fillerSource;

    @BeforeEach
    void setUp() {
        transport = mock(MailTransport.class);
        composer = mock(MessageComposer.class);
        pacer = new RecordingPacer();
        fillerSource = new ConfiguredFillerTrafficSource(List.of("warm1@example.com", "warm2@example.com"), new Random(3));
        when(composer.compose(any(), any(), any())).thenReturn(new ComposedMessage("Hello", "<p>Hi</p>", "Template 1"));
        when(transport.deliver(anyString(), anyString(), anyString(), anyString())).thenReturn(DeliveryResult.delivered());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private CampaignCycle cycle(InMemoryLedger ledger, DispatchOptions options, CandidateQueues queues) {
        QuotaSnapshot quota = new QuotaTracker(ledger, fixedClock(), options).snapshot();
        PacingExecutorFactory factory = new PacingExecutorFactory(options, composer, transport, pacer, ledger,
                fixedClock(), new DispatchMetricsRecorder(new SimpleMeterRegistry()));
        return new CampaignCycle("test-cycle", quota, queues, fillerSource, factory.create("test-cycle"), options,
                fixedClock());
    }

    private static CandidateQueues freshQueue(List<Recipient> recipients) {
        return new CandidateQueues(recipients.stream().map(Candidate::firstTouch).toList(), List.of());
    }

    private static List<TrafficCategory> categories(CycleSummary summary) {
        return summary.outcomes().stream().map(outcome -> outcome.candidate().category()).toList();
    }

    private static List<TrafficCategory> repeat(TrafficCategory category, int times) {
        return Collections.nCopies(times, category);
    }

    @DisplayName("Empty ledger with caps 15/5: five filler sends, then outreach sub-batches until 15 are sent")
    @Test
    void runShouldBurstFillerThenSendOutreachToCap() {
        InMemoryLedger ledger = new InMemoryLedger();

        CycleSummary summary = cycle(ledger, defaultOptions(), freshQueue(recipients(20))).run();

        List<TrafficCategory> expected = new ArrayList<>(repeat(F, 5));
        expected.addAll(repeat(O, 15));
        assertThat(categories(summary)).containsExactlyElementsOf(expected);
        assertThat(summary.endReason()).isEqualTo(CycleEndReason.OUTREACH_QUOTA_REACHED);
        assertThat(summary.finalState()).isEqualTo(CycleState.DONE);
        assertThat(summary.sent(O)).isEqualTo(15);
        assertThat(summary.sent(F)).isEqualTo(5);
        assertThat(summary.remainingFresh()).isEqualTo(5);
        assertThat(summary.quotaAfter().allExhausted()).isTrue();
        assertThat(ledger.entries()).hasSize(20).allMatch(LedgerEntry::isSent);
    }

    @DisplayName("Pacing delays separate sends within a batch only: 4 in the burst and 2 in each of five sub-batches")
    @Test
    void runShouldPaceOnlyWithinBatches() {
        cycle(new InMemoryLedger(), defaultOptions(), freshQueue(recipients(20))).run();

        List<DelayRange> expected = new ArrayList<>(Collections.nCopies(4, DelayRange.ofSeconds(60, 180)));
        expected.addAll(Collections.nCopies(10, DelayRange.ofSeconds(30, 120)));
        assertThat(pacer.pauses()).containsExactlyElementsOf(expected);
    }

    @DisplayName("Interleave phase sends one filler before each outreach sub-batch while filler quota remains")
    @Test
    void runShouldInterleaveFillerBetweenSubBatches() {
        DispatchOptions options = defaultOptions().toBuilder().fillerDailyCap(7).build();

        CycleSummary summary = cycle(new InMemoryLedger(), options, freshQueue(recipients(20))).run();

        List<TrafficCategory> expected = new ArrayList<>(repeat(F, 5));
        expected.add(F);
        expected.addAll(repeat(O, 3));
        expected.add(F);
        expected.addAll(repeat(O, 12));
        assertThat(categories(summary)).containsExactlyElementsOf(expected);
        assertThat(summary.quotaAfter().filler().consumed()).isEqualTo(7);
    }

    @DisplayName("Failed sends do not consume quota, so the cycle moves on to further candidates")
    @Test
    void failedSendsShouldNotConsumeQuota() {
        when(transport.deliver(anyString(), eq("lead1@example.com"), anyString(), anyString()))
                .thenReturn(DeliveryResult.failure("550 mailbox unavailable"));

        CycleSummary summary = cycle(new InMemoryLedger(), defaultOptions(), freshQueue(recipients(20))).run();

        assertThat(summary.sent(O)).isEqualTo(15);
        assertThat(summary.failed(O)).isEqualTo(1);
        assertThat(summary.remainingFresh()).isEqualTo(4);
        assertThat(summary.outcomes()).filteredOn(outcome -> !outcome.isSent())
                .singleElement()
                .satisfies(outcome -> {
                    assertThat(outcome.candidate().key()).isEqualTo("lead1@example.com");
                    assertThat(outcome.attempts()).isEqualTo(3);
                });
    }

    @DisplayName("Follow-ups are served once the fresh queue is empty and the cycle ends when candidates run out")
    @Test
    void followUpsShouldFollowFreshCandidates() {
        CandidateQueues queues = new CandidateQueues(
                List.of(Candidate.firstTouch(recipient("new@example.com"))),
                List.of(Candidate.followUp(recipient("old1@example.com"), 1, 8),
                        Candidate.followUp(recipient("old2@example.com"), 2, 20)));
        InMemoryLedger ledger = new InMemoryLedger();

        CycleSummary summary = cycle(ledger, defaultOptions(), queues).run();

        assertThat(summary.endReason()).isEqualTo(CycleEndReason.CANDIDATES_EXHAUSTED);
        assertThat(summary.outcomes()).filteredOn(outcome -> outcome.candidate().category().isOutreach())
                .extracting(outcome -> outcome.candidate().key())
                .containsExactly("new@example.com", "old1@example.com", "old2@example.com");
        assertThat(ledger.entries()).filteredOn(entry -> entry.category() == TrafficCategory.FOLLOW_UP)
                .extracting(LedgerEntry::sequence)
                .containsExactly(1, 2);
        assertThat(summary.quotaAfter().outreach().consumed()).isEqualTo(3);
    }

    @DisplayName("Cycle with both quotas already reached sends nothing")
    @Test
    void exhaustedQuotasShouldEndImmediately() {
        List<LedgerEntry> today = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            today.add(sent("lead" + i + "@example.com", O, null, now().minusHours(1)));
        }
        for (int i = 0; i < 5; i++) {
            today.add(sent("warm1@example.com", F, null, now().minusHours(1)));
        }
        InMemoryLedger ledger = new InMemoryLedger(today.toArray(LedgerEntry[]::new));

        CycleSummary summary = cycle(ledger, defaultOptions(), freshQueue(recipients(3))).run();

        assertThat(summary.endReason()).isEqualTo(CycleEndReason.ALL_QUOTAS_REACHED);
        assertThat(summary.outcomes()).isEmpty();
        assertThat(summary.remainingFresh()).isEqualTo(3);
        verify(transport, never()).deliver(anyString(), anyString(), anyString(), anyString());
    }

    @DisplayName("Filler quota reached early still lets outreach run without filler sends")
    @Test
    void fillerQuotaReachedShouldSkipFiller() {
        List<LedgerEntry> today = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            today.add(sent("warm1@example.com", F, null, now().minusHours(2)));
        }
        CycleSummary summary = cycle(new InMemoryLedger(today.toArray(LedgerEntry[]::new)), defaultOptions(),
                freshQueue(recipients(4))).run();

        assertThat(categories(summary)).containsExactlyElementsOf(repeat(O, 4));
        assertThat(summary.endReason()).isEqualTo(CycleEndReason.CANDIDATES_EXHAUSTED);
    }

    @DisplayName("Without any filler address the cycle sends outreach only")
    @Test
    void missingFillerSourceShouldNotBlockOutreach() {
        fillerSource = Optional::empty;

        CycleSummary summary = cycle(new InMemoryLedger(), defaultOptions(), freshQueue(recipients(4))).run();

        assertThat(summary.sent(F)).isZero();
        assertThat(summary.sent(O)).isEqualTo(4);
        assertThat(summary.endReason()).isEqualTo(CycleEndReason.CANDIDATES_EXHAUSTED);
    }

    @DisplayName("Interrupt between sends ends the cycle as INTERRUPTED and keeps the interrupt flag")
    @Test
    void interruptShouldEndCycle() {
        pacer.onPause(() -> Thread.currentThread().interrupt());
        InMemoryLedger ledger = new InMemoryLedger();

        CycleSummary summary = cycle(ledger, defaultOptions(), freshQueue(recipients(5))).run();

        assertThat(summary.endReason()).isEqualTo(CycleEndReason.INTERRUPTED);
        assertThat(summary.finalState()).isEqualTo(CycleState.DONE);
        assertThat(summary.outcomes()).hasSize(1);
        assertThat(ledger.entries()).hasSize(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @DisplayName("A cycle instance runs only once")
    @Test
    void secondRunShouldFail() {
        CampaignCycle cycle = cycle(new InMemoryLedger(), defaultOptions(), CandidateQueues.empty());
        cycle.run();

        assertThatThrownBy(cycle::run).isInstanceOf(IllegalStateException.class);
    }

    @DisplayName("Every outcome in the summary is backed by one ledger entry with the same status")
    @Test
    void outcomesShouldMatchLedger() {
        when(transport.deliver(anyString(), eq("lead2@example.com"), anyString(), anyString()))
                .thenReturn(DeliveryResult.failure("timeout"));
        InMemoryLedger ledger = new InMemoryLedger();

        CycleSummary summary = cycle(ledger, defaultOptions(), freshQueue(recipients(3))).run();

        assertThat(ledger.entries()).extracting(LedgerEntry::status)
                .containsExactlyElementsOf(summary.outcomes().stream().map(SendOutcome::status).toList());
        assertThat(ledger.entries()).filteredOn(entry -> entry.status() == SendStatus.FAILED)
                .extracting(LedgerEntry::recipientKey)
                .containsExactly("lead2@example.com");
    }
}
