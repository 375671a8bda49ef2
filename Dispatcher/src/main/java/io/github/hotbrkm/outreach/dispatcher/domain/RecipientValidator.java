package io.github.hotbrkm.outreach.dispatcher.domain;

/**
 * Checks the fields a recipient needs before it may be scheduled.
 */
public final class RecipientValidator {

    private RecipientValidator() {}

    /**
     * @throws RecipientValidationException if the address is invalid or a name/organization field is empty
     */
    public static void validate(Recipient recipient) {
        if (recipient == null) {
            throw new RecipientValidationException(null, "Recipient must not be null");
        }
        String key = recipient.key();
        if (!EmailAddressUtil.isValid(key)) {
            throw new RecipientValidationException(key, "Invalid or missing email: '" + key + "'");
        }
        if (recipient.getFirstName().isEmpty() || recipient.getLastName().isEmpty()) {
            throw new RecipientValidationException(key, "Missing first name or last name");
        }
        if (recipient.getOrganization().isEmpty()) {
            throw new RecipientValidationException(key, "Missing organization name");
        }
    }
}
