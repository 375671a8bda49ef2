package io.github.hotbrkm.outreach.dispatcher.eligibility;

import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Map;

/**
 * Contact history of one recipient, folded from the ledger. Only SENT entries move the timestamps and counts.
 *
 * @param lastOutreachSent        last SENT first-touch or follow-up, null if none
 * @param highestFollowUpSequence highest SENT follow-up sequence, 0 if none
 */
public record RecipientHistory(String recipientKey,
                               OffsetDateTime firstSent,
                               OffsetDateTime lastSent,
                               OffsetDateTime lastOutreachSent,
                               Map<TrafficCategory, Integer> sentCounts,
                               int highestFollowUpSequence,
                               int failedAttempts) {

    public RecipientHistory {
        sentCounts = sentCounts == null ? Map.of() : Collections.unmodifiableMap(sentCounts);
    }

    public static RecipientHistory empty(String recipientKey) {
        return new RecipientHistory(recipientKey, null, null, null, Map.of(), 0, 0);
    }

    public int sentCount(TrafficCategory category) {
        return sentCounts.getOrDefault(category, 0);
    }

    public boolean hasAnySent() {
        return lastSent != null;
    }

    public boolean hasOutreachSent() {
        return lastOutreachSent != null;
    }
}
