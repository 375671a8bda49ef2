package io.github.hotbrkm.outreach.dispatcher.source;

import io.github.hotbrkm.outreach.dispatcher.send.Candidate;

import java.util.Optional;

/**
 * Produces filler-traffic candidates on demand.
 */
public interface FillerTrafficSource {

    /**
     * @return the next filler candidate, or empty if no filler address is available
     */
    Optional<Candidate> nextFiller();
}
