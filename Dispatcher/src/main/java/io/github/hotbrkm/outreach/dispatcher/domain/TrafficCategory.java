package io.github.hotbrkm.outreach.dispatcher.domain;

import java.util.Locale;

/**
 * Role a single send plays in a campaign.
 * <p>
 * First-touch and follow-up sends go to the recipient pool and share the {@link QuotaBucket#OUTREACH} ceiling.
 * Filler sends go to the configured warm-up pool and are counted against {@link QuotaBucket#FILLER}.
 */
public enum TrafficCategory {

    FIRST_TOUCH("first_touch", QuotaBucket.OUTREACH),
    FOLLOW_UP("follow_up", QuotaBucket.OUTREACH),
    FILLER("filler", QuotaBucket.FILLER);

    private final String code;
    private final QuotaBucket bucket;

    TrafficCategory(String code, QuotaBucket bucket) {
        this.code = code;
        this.bucket = bucket;
    }

    public String code() {
        return code;
    }

    public QuotaBucket bucket() {
        return bucket;
    }

    public boolean isOutreach() {
        return bucket == QuotaBucket.OUTREACH;
    }

    /**
     * Resolves a ledger code. Also accepts the type labels written by the legacy send log
     * ({@code cold}, {@code followup}, {@code warmup}).
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static TrafficCategory fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Traffic category code must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "first_touch", "cold" -> FIRST_TOUCH;
            case "follow_up", "followup" -> FOLLOW_UP;
            case "filler", "warmup" -> FILLER;
            default -> throw new IllegalArgumentException("Unknown traffic category: " + code);
        };
    }
}
