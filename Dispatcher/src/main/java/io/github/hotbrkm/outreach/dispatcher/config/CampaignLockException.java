package io.github.hotbrkm.outreach.dispatcher.config;

/**
 * Another dispatcher already holds the ledger. Only one scheduler may run per ledger at a time.
 */
public class CampaignLockException extends CampaignConfigException {
    public CampaignLockException(String message) {
        super(message);
    }

    public CampaignLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
