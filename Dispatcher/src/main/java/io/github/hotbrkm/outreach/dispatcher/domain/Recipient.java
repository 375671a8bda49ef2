package io.github.hotbrkm.outreach.dispatcher.domain;

import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * A contact from the recipient pool. Identity is the normalized e-mail address.
 */
@Getter
public final class Recipient {

    private final String email;
    private final String firstName;
    private final String lastName;
    private final String organization;
    private final String title;
    private final String city;
    private final String state;
    private final String country;
    private final String website;
    private final String industry;

    @Builder(toBuilder = true)
    public Recipient(String email, String firstName, String lastName, String organization, String title,
                     String city, String state, String country, String website, String industry) {
        this.email = EmailAddressUtil.normalize(email);
        this.firstName = clean(firstName);
        this.lastName = clean(lastName);
        this.organization = clean(organization);
        this.title = clean(title);
        this.city = clean(city);
        this.state = clean(state);
        this.country = clean(country);
        this.website = clean(website);
        this.industry = clean(industry);
    }

    /**
     * Recipient used for filler traffic, which only carries an address.
     */
    public static Recipient ofAddress(String email) {
        return Recipient.builder().email(email).build();
    }

    public String key() {
        return email;
    }

    public String displayName() {
        String full = (firstName + " " + lastName).trim();
        return full.isEmpty() ? null : full;
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(email, ((Recipient) o).email);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(email);
    }

    @Override
    public String toString() {
        return "Recipient[email=" + email + ", organization=" + organization + "]";
    }
}
