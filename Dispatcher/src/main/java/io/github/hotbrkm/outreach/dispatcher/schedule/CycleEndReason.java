package io.github.hotbrkm.outreach.dispatcher.schedule;

/**
 * Why a cycle reached {@link CycleState#DONE}.
 */
public enum CycleEndReason {
    /** Both buckets were already at their ceiling; nothing was sent. */
    ALL_QUOTAS_REACHED,
    OUTREACH_QUOTA_REACHED,
    /** Fresh and follow-up queues ran dry before the outreach ceiling. */
    CANDIDATES_EXHAUSTED,
    INTERRUPTED
}
