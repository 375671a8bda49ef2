package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.send.Candidate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Outreach candidates of one cycle. Fresh recipients are always served before due follow-ups.
 */
public final class CandidateQueues {

    private final Deque<Candidate> fresh;
    private final Deque<Candidate> followUps;

    public CandidateQueues(List<Candidate> fresh, List<Candidate> followUps) {
        this.fresh = new ArrayDeque<>(fresh);
        this.followUps = new ArrayDeque<>(followUps);
    }

    public static CandidateQueues empty() {
        return new CandidateQueues(List.of(), List.of());
    }

    public Optional<Candidate> nextOutreach() {
        Candidate next = fresh.pollFirst();
        if (next == null) {
            next = followUps.pollFirst();
        }
        return Optional.ofNullable(next);
    }

    public boolean isEmpty() {
        return fresh.isEmpty() && followUps.isEmpty();
    }

    public int freshSize() {
        return fresh.size();
    }

    public int followUpSize() {
        return followUps.size();
    }
}
