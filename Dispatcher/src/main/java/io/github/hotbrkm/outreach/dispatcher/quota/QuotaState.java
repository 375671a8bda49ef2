package io.github.hotbrkm.outreach.dispatcher.quota;

import io.github.hotbrkm.outreach.dispatcher.domain.QuotaBucket;

/**
 * Daily usage of one quota bucket.
 */
public record QuotaState(QuotaBucket bucket, int ceiling, int consumed) {

    public int remaining() {
        return Math.max(0, ceiling - consumed);
    }

    public boolean isExhausted() {
        return remaining() == 0;
    }
}
