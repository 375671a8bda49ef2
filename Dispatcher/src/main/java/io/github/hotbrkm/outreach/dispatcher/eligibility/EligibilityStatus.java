package io.github.hotbrkm.outreach.dispatcher.eligibility;

public enum EligibilityStatus {
    /** Never successfully contacted. */
    FRESH,
    FOLLOW_UP_DUE,
    FOLLOW_UP_NOT_YET_DUE,
    /** All follow-ups already sent. */
    EXHAUSTED,
    /** Only ever received filler traffic; never used for outreach. */
    INELIGIBLE
}
