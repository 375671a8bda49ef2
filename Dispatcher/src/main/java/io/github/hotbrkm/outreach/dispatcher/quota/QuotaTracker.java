package io.github.hotbrkm.outreach.dispatcher.quota;

import io.github.hotbrkm.outreach.dispatcher.config.DispatchOptions;
import io.github.hotbrkm.outreach.dispatcher.domain.QuotaBucket;
import io.github.hotbrkm.outreach.dispatcher.ledger.Ledger;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Counts today's successful sends per bucket from the ledger.
 * <p>
 * "Today" is the calendar date in the zone of the injected {@link Clock}.
 */
@Slf4j
public class QuotaTracker {

    private final Ledger ledger;
    private final Clock clock;
    private final DispatchOptions options;

    public QuotaTracker(Ledger ledger, Clock clock, DispatchOptions options) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public QuotaSnapshot snapshot() {
        return snapshot(LocalDate.now(clock));
    }

    public QuotaSnapshot snapshot(LocalDate today) {
        Objects.requireNonNull(today, "today must not be null");
        ZoneId zone = clock.getZone();
        EnumMap<QuotaBucket, Integer> consumed = new EnumMap<>(QuotaBucket.class);
        try (Stream<LedgerEntry> entries = ledger.scan()) {
            entries.filter(LedgerEntry::isSent)
                    .filter(entry -> entry.timestamp().atZoneSameInstant(zone).toLocalDate().equals(today))
                    .forEach(entry -> consumed.merge(entry.category().bucket(), 1, Integer::sum));
        }

        QuotaSnapshot snapshot = new QuotaSnapshot(today,
                state(QuotaBucket.OUTREACH, consumed),
                state(QuotaBucket.FILLER, consumed));
        log.info("Quota snapshot. date={}, outreach={}/{}, filler={}/{}", today,
                snapshot.outreach().consumed(), snapshot.outreach().ceiling(),
                snapshot.filler().consumed(), snapshot.filler().ceiling());
        return snapshot;
    }

    private QuotaState state(QuotaBucket bucket, EnumMap<QuotaBucket, Integer> consumed) {
        return new QuotaState(bucket, options.ceiling(bucket), consumed.getOrDefault(bucket, 0));
    }
}
