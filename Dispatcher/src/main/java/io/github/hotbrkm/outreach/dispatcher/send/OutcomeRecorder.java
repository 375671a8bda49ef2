package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.ledger.Ledger;
import io.github.hotbrkm.outreach.dispatcher.ledger.LedgerEntry;
import io.github.hotbrkm.outreach.dispatcher.ledger.SendStatus;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Writes the ledger entry for a finished send.
 */
public class OutcomeRecorder {

    private final Ledger ledger;
    private final Clock clock;

    public OutcomeRecorder(Ledger ledger, Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Appends one entry. {@link io.github.hotbrkm.outreach.dispatcher.ledger.LedgerIOException} propagates.
     *
     * @param message composed message, null when composition failed
     */
    public LedgerEntry record(Candidate candidate, SendStatus status, ComposedMessage message) {
        Recipient recipient = candidate.recipient();
        LedgerEntry entry = LedgerEntry.builder()
                .timestamp(OffsetDateTime.now(clock))
                .recipientKey(recipient.key())
                .status(status)
                .category(candidate.category())
                .sequence(candidate.sequence())
                .subject(message == null ? "" : message.subject())
                .firstName(recipient.getFirstName())
                .lastName(recipient.getLastName())
                .organization(recipient.getOrganization())
                .templateUsed(message == null ? "" : message.templateUsed())
                .build();
        ledger.append(entry);
        return entry;
    }
}
