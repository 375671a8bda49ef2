package io.github.hotbrkm.outreach.dispatcher.config;

/**
 * Missing or invalid campaign configuration. Raised before any send is attempted.
 */
public class CampaignConfigException extends RuntimeException {
    public CampaignConfigException(String message) {
        super(message);
    }

    public CampaignConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
