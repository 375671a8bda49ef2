package io.github.hotbrkm.outreach.dispatcher.eligibility;

import java.util.List;

/**
 * How many follow-ups a recipient may receive and how long to wait before each one.
 */
public record FollowUpPolicy(int maxFollowups, List<Integer> intervalsDays) {

    public static final FollowUpPolicy DEFAULT = new FollowUpPolicy(3, List.of(7, 14, 21));

    public FollowUpPolicy {
        if (maxFollowups < 0) {
            throw new IllegalArgumentException("maxFollowups must not be negative");
        }
        intervalsDays = intervalsDays == null ? List.of() : List.copyOf(intervalsDays);
        if (maxFollowups > 0 && intervalsDays.isEmpty()) {
            throw new IllegalArgumentException("intervalsDays must not be empty when follow-ups are enabled");
        }
    }

    /**
     * Days to wait since the last outreach send before follow-up {@code sequence} is due.
     * Sequences past the configured list reuse the last interval.
     */
    public int intervalFor(int sequence) {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be at least 1 but was " + sequence);
        }
        int index = Math.min(sequence, intervalsDays.size()) - 1;
        return intervalsDays.get(index);
    }
}
