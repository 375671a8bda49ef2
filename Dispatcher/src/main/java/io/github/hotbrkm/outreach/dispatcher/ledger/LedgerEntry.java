package io.github.hotbrkm.outreach.dispatcher.ledger;

import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One immutable line of the send history.
 * <p>
 * {@code sequence} is present only for {@link TrafficCategory#FOLLOW_UP} entries and starts at 1.
 * The name/organization fields are a snapshot taken at send time.
 */
@Builder(toBuilder = true)
public record LedgerEntry(OffsetDateTime timestamp,
                          String recipientKey,
                          SendStatus status,
                          TrafficCategory category,
                          Integer sequence,
                          String subject,
                          String firstName,
                          String lastName,
                          String organization,
                          String templateUsed) {

    public LedgerEntry {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(recipientKey, "recipientKey must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (category == TrafficCategory.FOLLOW_UP) {
            if (sequence == null || sequence < 1) {
                throw new IllegalArgumentException("Follow-up entry for " + recipientKey + " needs a sequence >= 1");
            }
        } else if (sequence != null) {
            throw new IllegalArgumentException("Only follow-up entries carry a sequence: " + recipientKey);
        }
        subject = subject == null ? "" : subject;
        firstName = firstName == null ? "" : firstName;
        lastName = lastName == null ? "" : lastName;
        organization = organization == null ? "" : organization;
        templateUsed = templateUsed == null ? "" : templateUsed;
    }

    public boolean isSent() {
        return status == SendStatus.SENT;
    }

    public boolean isOutreach() {
        return category.isOutreach();
    }
}
