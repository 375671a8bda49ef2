package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.ledger.SendStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class DispatchMetricsRecorder {

    private final MeterRegistry registry;

    public DispatchMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordAttempt(TrafficCategory category, DeliveryResult result) {
        if (result == null) {
            return;
        }
        registry.counter("campaign.dispatch.transport.attempts",
                "category", tag(category),
                "result", result.success() ? "success" : "failure")
                .increment();
    }

    public void recordOutcome(TrafficCategory category, SendStatus status) {
        if (status == null) {
            return;
        }
        registry.counter("campaign.dispatch.send.total",
                "category", tag(category),
                "outcome", status.code())
                .increment();
    }

    public void recordPacingDelay(TrafficCategory category, Duration delay) {
        if (delay == null || delay.isNegative()) {
            return;
        }
        registry.summary("campaign.dispatch.pacing.delay.millis",
                "category", tag(category))
                .record(delay.toMillis());
    }

    private String tag(TrafficCategory category) {
        return category == null ? "none" : category.code();
    }
}
