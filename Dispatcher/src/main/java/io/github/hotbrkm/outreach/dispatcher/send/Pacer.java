package io.github.hotbrkm.outreach.dispatcher.send;

import java.time.Duration;

/**
 * Blocking waits used between sends and between retries. Replaced by a recording no-op in tests.
 */
public interface Pacer {

    /**
     * Waits for a duration chosen inside {@code range}.
     *
     * @return the duration waited
     */
    Duration pause(DelayRange range) throws InterruptedException;

    void await(Duration duration) throws InterruptedException;
}
