package io.github.hotbrkm.outreach.dispatcher.send;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RandomPacer test")
class RandomPacerTest {

    @DisplayName("Picked delays stay inside the inclusive range")
    @Test
    void pickShouldStayWithinRange() {
        RandomPacer pacer = new RandomPacer(new Random(42));
        DelayRange range = DelayRange.ofSeconds(30, 120);

        for (int i = 0; i < 1_000; i++) {
            assertThat(pacer.pick(range)).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(120));
        }
    }

    @DisplayName("Degenerate range returns its single value without sleeping")
    @Test
    void zeroRangeShouldNotSleep() throws InterruptedException {
        RandomPacer pacer = new RandomPacer(new Random());

        long start = System.nanoTime();
        Duration waited = pacer.pause(DelayRange.NONE);

        assertThat(waited).isZero();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
    }
}
