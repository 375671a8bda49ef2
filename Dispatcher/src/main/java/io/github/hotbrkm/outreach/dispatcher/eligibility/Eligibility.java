package io.github.hotbrkm.outreach.dispatcher.eligibility;

/**
 * Result of evaluating one recipient.
 *
 * @param sequence      next follow-up number, null unless a follow-up is due or pending
 * @param daysSinceLast whole days since the last outreach send, null for fresh recipients
 */
public record Eligibility(EligibilityStatus status, Integer sequence, Long daysSinceLast) {

    private static final Eligibility FRESH = new Eligibility(EligibilityStatus.FRESH, null, null);
    private static final Eligibility INELIGIBLE = new Eligibility(EligibilityStatus.INELIGIBLE, null, null);

    public static Eligibility fresh() {
        return FRESH;
    }

    public static Eligibility ineligible() {
        return INELIGIBLE;
    }

    public static Eligibility exhausted(long daysSinceLast) {
        return new Eligibility(EligibilityStatus.EXHAUSTED, null, daysSinceLast);
    }

    public static Eligibility followUpDue(int sequence, long daysSinceLast) {
        return new Eligibility(EligibilityStatus.FOLLOW_UP_DUE, sequence, daysSinceLast);
    }

    public static Eligibility followUpNotYetDue(int sequence, long daysSinceLast) {
        return new Eligibility(EligibilityStatus.FOLLOW_UP_NOT_YET_DUE, sequence, daysSinceLast);
    }
}
