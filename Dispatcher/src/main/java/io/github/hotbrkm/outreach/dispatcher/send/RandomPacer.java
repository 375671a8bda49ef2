package io.github.hotbrkm.outreach.dispatcher.send;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Sleeps for a uniformly random duration, both bounds inclusive, at millisecond resolution.
 */
public class RandomPacer implements Pacer {

    private final Random random;

    public RandomPacer(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public Duration pause(DelayRange range) throws InterruptedException {
        Duration delay = pick(range);
        await(delay);
        return delay;
    }

    @Override
    public void await(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        Thread.sleep(duration.toMillis());
    }

    Duration pick(DelayRange range) {
        long min = range.min().toMillis();
        long max = range.max().toMillis();
        if (max <= min) {
            return Duration.ofMillis(min);
        }
        long offset = (long) (random.nextDouble() * (max - min + 1));
        return Duration.ofMillis(Math.min(max, min + offset));
    }
}
