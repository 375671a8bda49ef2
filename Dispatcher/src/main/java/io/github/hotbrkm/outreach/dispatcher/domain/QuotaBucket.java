package io.github.hotbrkm.outreach.dispatcher.domain;

/**
 * Daily ceilings are tracked per bucket, not per category.
 */
public enum QuotaBucket {
    OUTREACH,
    FILLER
}
