package io.github.hotbrkm.outreach.dispatcher.support;

import io.github.hotbrkm.outreach.dispatcher.config.DispatchOptions;
import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.eligibility.FollowUpPolicy;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerEntry;
import io.github.hotbrkm.outreach.dispatcher.ledger.SendStatus;
import io.github.hotbrkm.outreach.dispatcher.send.DelayRange;
import io.github.hotbrkm.outreach.dispatcher.send.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class TestFixtures {

    public static final ZoneId ZONE = ZoneOffset.UTC;
    public static final Instant NOW = Instant.parse("2025-03-10T10:00:00Z");
    public static final String FROM = "sender@outreach.example";

    private TestFixtures() {}

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZONE);
    }

    public static OffsetDateTime now() {
        return OffsetDateTime.ofInstant(NOW, ZONE);
    }

    public static DispatchOptions defaultOptions() {
        return DispatchOptions.builder()
                .fromAddress(FROM)
                .firstTouchDailyCap(15)
                .fillerDailyCap(5)
                .retryPolicy(new RetryPolicy(3, Duration.ofSeconds(5)))
                .fillerDelay(DelayRange.ofSeconds(60, 180))
                .outreachDelay(DelayRange.ofSeconds(30, 120))
                .followUpPolicy(FollowUpPolicy.DEFAULT)
                .subBatchSize(3)
                .initialBurstSize(5)
                .build();
    }

    public static Recipient recipient(String email) {
        return Recipient.builder()
                .email(email)
                .firstName("Ada")
                .lastName("Lovelace")
                .organization("Analytical Engines")
                .build();
    }

    public static List<Recipient> recipients(int count) {
        List<Recipient> recipients = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            recipients.add(recipient("lead" + i + "@example.com"));
        }
        return recipients;
    }

    public static LedgerEntry sent(String key, TrafficCategory category, Integer sequence, OffsetDateTime at) {
        return entry(key, SendStatus.SENT, category, sequence, at);
    }

    public static LedgerEntry failed(String key, TrafficCategory category, Integer sequence, OffsetDateTime at) {
        return entry(key, SendStatus.FAILED, category, sequence, at);
    }

    public static LedgerEntry entry(String key, SendStatus status, TrafficCategory category, Integer sequence,
                                    OffsetDateTime at) {
        return LedgerEntry.builder()
                .timestamp(at)
                .recipientKey(key)
                .status(status)
                .category(category)
                .sequence(sequence)
                .subject("subject")
                .build();
    }
}
