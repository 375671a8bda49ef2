package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.ledger.SendStatus;

/**
 * What happened to one candidate. Exactly one ledger entry backs every outcome.
 *
 * @param attempts transport calls made, 0 when composition failed
 */
public record SendOutcome(Candidate candidate, SendStatus status, int attempts, String failureReason) {

    public static SendOutcome sent(Candidate candidate, int attempts) {
        return new SendOutcome(candidate, SendStatus.SENT, attempts, null);
    }

    public static SendOutcome failed(Candidate candidate, int attempts, String reason) {
        return new SendOutcome(candidate, SendStatus.FAILED, attempts, reason);
    }

    public boolean isSent() {
        return status == SendStatus.SENT;
    }
}
