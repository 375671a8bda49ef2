package io.github.hotbrkm.outreach.dispatcher.eligibility;

import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.ledger.Ledger;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerEntry;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Per-recipient histories rebuilt from a single pass over the ledger.
 * <p>
 * Built once per cycle and never cached across cycles.
 */
public final class LedgerHistory {

    private final Map<String, RecipientHistory> histories;

    private LedgerHistory(Map<String, RecipientHistory> histories) {
        this.histories = Collections.unmodifiableMap(histories);
    }

    public static LedgerHistory load(Ledger ledger) {
        try (Stream<LedgerEntry> entries = ledger.scan()) {
            return fold(entries);
        }
    }

    public static LedgerHistory fold(Stream<LedgerEntry> entries) {
        Map<String, Accumulator> accumulators = new HashMap<>();
        entries.forEach(entry -> accumulators
                .computeIfAbsent(entry.recipientKey(), key -> new Accumulator())
                .add(entry));

        Map<String, RecipientHistory> histories = new HashMap<>();
        accumulators.forEach((key, accumulator) -> histories.put(key, accumulator.toHistory(key)));
        return new LedgerHistory(histories);
    }

    public RecipientHistory forRecipient(String recipientKey) {
        RecipientHistory history = histories.get(recipientKey);
        return history == null ? RecipientHistory.empty(recipientKey) : history;
    }

    public int size() {
        return histories.size();
    }

    private static final class Accumulator {
        private OffsetDateTime firstSent;
        private OffsetDateTime lastSent;
        private OffsetDateTime lastOutreachSent;
        private final EnumMap<TrafficCategory, Integer> sentCounts = new EnumMap<>(TrafficCategory.class);
        private int highestFollowUpSequence;
        private int failedAttempts;

        void add(LedgerEntry entry) {
            if (!entry.isSent()) {
                failedAttempts++;
                return;
            }
            OffsetDateTime at = entry.timestamp();
            if (firstSent == null || at.isBefore(firstSent)) {
                firstSent = at;
            }
            if (lastSent == null || at.isAfter(lastSent)) {
                lastSent = at;
            }
            if (entry.isOutreach() && (lastOutreachSent == null || at.isAfter(lastOutreachSent))) {
                lastOutreachSent = at;
            }
            sentCounts.merge(entry.category(), 1, Integer::sum);
            if (entry.category() == TrafficCategory.FOLLOW_UP) {
                highestFollowUpSequence = Math.max(highestFollowUpSequence, entry.sequence());
            }
        }

        RecipientHistory toHistory(String key) {
            return new RecipientHistory(key, firstSent, lastSent, lastOutreachSent, new EnumMap<>(sentCounts),
                    highestFollowUpSequence, failedAttempts);
        }
    }
}
