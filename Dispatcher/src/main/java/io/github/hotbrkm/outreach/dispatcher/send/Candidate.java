package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;

import java.util.Objects;

/**
 * A recipient selected for exactly one send in the current cycle.
 *
 * @param sequence      follow-up number, only for {@link TrafficCategory#FOLLOW_UP}
 * @param daysSinceLast days since the last outreach send, only for follow-ups
 */
public record Candidate(Recipient recipient, TrafficCategory category, Integer sequence, Long daysSinceLast) {

    public Candidate {
        Objects.requireNonNull(recipient, "recipient must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (category == TrafficCategory.FOLLOW_UP && (sequence == null || sequence < 1)) {
            throw new IllegalArgumentException("Follow-up candidate needs a sequence >= 1: " + recipient.key());
        }
    }

    public static Candidate firstTouch(Recipient recipient) {
        return new Candidate(recipient, TrafficCategory.FIRST_TOUCH, null, null);
    }

    public static Candidate followUp(Recipient recipient, int sequence, long daysSinceLast) {
        return new Candidate(recipient, TrafficCategory.FOLLOW_UP, sequence, daysSinceLast);
    }

    public static Candidate filler(Recipient recipient) {
        return new Candidate(recipient, TrafficCategory.FILLER, null, null);
    }

    public String key() {
        return recipient.key();
    }
}
