package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.eligibility.Eligibility;
import io.github.hotbrkm.outreach.dispatcher.eligibility.EligibilityCalculator;
import io.github.hotbrkm.outreach.dispatcher.eligibility.EligibilityStatus;
import io.github.hotbrkm.outreach.dispatcher.eligibility.LedgerHistory;
import io.github.hotbrkm.outreach.dispatcher.send.Candidate;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Sorts the recipient pool into fresh and follow-up queues, keeping source order within each queue.
 */
@Slf4j
public class CandidateQueueBuilder {

    private final EligibilityCalculator calculator;

    public CandidateQueueBuilder(EligibilityCalculator calculator) {
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
    }

    public CandidateQueues build(List<Recipient> recipients, LedgerHistory history, OffsetDateTime now) {
        List<Candidate> fresh = new ArrayList<>();
        List<Candidate> followUps = new ArrayList<>();
        EnumMap<EligibilityStatus, Integer> counts = new EnumMap<>(EligibilityStatus.class);
        Set<String> seen = new HashSet<>();

        for (Recipient recipient : recipients) {
            if (!seen.add(recipient.key())) {
                continue;
            }
            Eligibility eligibility = calculator.evaluate(history.forRecipient(recipient.key()), now);
            counts.merge(eligibility.status(), 1, Integer::sum);
            switch (eligibility.status()) {
                case FRESH -> fresh.add(Candidate.firstTouch(recipient));
                case FOLLOW_UP_DUE -> followUps.add(
                        Candidate.followUp(recipient, eligibility.sequence(), eligibility.daysSinceLast()));
                default -> {
                    // not sendable this cycle
                }
            }
        }
        log.info("Candidate queues built. fresh={}, followUpsDue={}, eligibility={}", fresh.size(), followUps.size(), counts);
        return new CandidateQueues(fresh, followUps);
    }
}
