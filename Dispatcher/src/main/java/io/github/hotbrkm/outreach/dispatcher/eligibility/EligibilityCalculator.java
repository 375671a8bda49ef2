package io.github.hotbrkm.outreach.dispatcher.eligibility;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Decides whether a recipient is fresh, due for a follow-up, or done. Pure; reads nothing but its arguments.
 */
public class EligibilityCalculator {

    private final FollowUpPolicy policy;

    public EligibilityCalculator(FollowUpPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public Eligibility evaluate(RecipientHistory history, OffsetDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        if (history == null || !history.hasAnySent()) {
            return Eligibility.fresh();
        }
        if (!history.hasOutreachSent()) {
            return Eligibility.ineligible();
        }

        long daysSinceLast = Math.max(0, Duration.between(history.lastOutreachSent(), now).toDays());
        int sentFollowUps = history.highestFollowUpSequence();
        if (sentFollowUps >= policy.maxFollowups()) {
            return Eligibility.exhausted(daysSinceLast);
        }

        int next = sentFollowUps + 1;
        if (daysSinceLast >= policy.intervalFor(next)) {
            return Eligibility.followUpDue(next, daysSinceLast);
        }
        return Eligibility.followUpNotYetDue(next, daysSinceLast);
    }
}
