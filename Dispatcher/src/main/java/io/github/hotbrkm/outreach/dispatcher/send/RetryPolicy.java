package io.github.hotbrkm.outreach.dispatcher.send;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded transport retry with a fixed wait between attempts.
 *
 * @param maxAttempts total transport calls allowed per candidate
 * @param retryWait   wait before each attempt after the first
 */
public record RetryPolicy(int maxAttempts, Duration retryWait) {

    public RetryPolicy {
        Objects.requireNonNull(retryWait, "retryWait must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (retryWait.isNegative()) {
            throw new IllegalArgumentException("retryWait must not be negative");
        }
    }

    public boolean canAttempt(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }
}
