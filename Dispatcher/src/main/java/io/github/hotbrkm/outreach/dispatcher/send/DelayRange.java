package io.github.hotbrkm.outreach.dispatcher.send;

import java.time.Duration;
import java.util.Objects;

/**
 * Inclusive bounds of a randomized wait.
 */
public record DelayRange(Duration min, Duration max) {

    public static final DelayRange NONE = new DelayRange(Duration.ZERO, Duration.ZERO);

    public DelayRange {
        Objects.requireNonNull(min, "min must not be null");
        Objects.requireNonNull(max, "max must not be null");
        if (min.isNegative() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("Invalid delay range: " + min + ".." + max);
        }
    }

    public static DelayRange ofSeconds(long minSeconds, long maxSeconds) {
        return new DelayRange(Duration.ofSeconds(minSeconds), Duration.ofSeconds(maxSeconds));
    }
}
