package io.github.hotbrkm.outreach.dispatcher.ledger;

import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Lifetime totals of a ledger, logged at the end of each cycle.
 */
public record LedgerStatistics(int totalAttempts, int failed, Map<TrafficCategory, Integer> sentByCategory) {

    public static LedgerStatistics of(Stream<LedgerEntry> entries) {
        EnumMap<TrafficCategory, Integer> sent = new EnumMap<>(TrafficCategory.class);
        int total = 0;
        int failed = 0;
        for (LedgerEntry entry : (Iterable<LedgerEntry>) entries::iterator) {
            total++;
            if (entry.isSent()) {
                sent.merge(entry.category(), 1, Integer::sum);
            } else {
                failed++;
            }
        }
        return new LedgerStatistics(total, failed, Collections.unmodifiableMap(sent));
    }

    /**
     * Reads the whole ledger once.
     */
    public static LedgerStatistics of(Ledger ledger) {
        try (Stream<LedgerEntry> entries = ledger.scan()) {
            return of(entries);
        }
    }

    public int sent(TrafficCategory category) {
        return sentByCategory.getOrDefault(category, 0);
    }

    public int totalSent() {
        return totalAttempts - failed;
    }

    public double successRate() {
        return totalAttempts > 0 ? (totalSent() * 100.0) / totalAttempts : 0.0;
    }
}
