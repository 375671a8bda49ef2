package io.github.hotbrkm.outreach.dispatcher.domain;

/**
 * A single recipient record is malformed. The record is skipped; the cycle continues.
 */
public class RecipientValidationException extends RuntimeException {

    private final String recipientKey;

    public RecipientValidationException(String recipientKey, String message) {
        super(message);
        this.recipientKey = recipientKey;
    }

    public String getRecipientKey() {
        return recipientKey;
    }
}
