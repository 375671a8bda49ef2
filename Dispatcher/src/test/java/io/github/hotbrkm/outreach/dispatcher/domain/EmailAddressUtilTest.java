package io.github.hotbrkm.outreach.dispatcher.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmailAddressUtil test")
class EmailAddressUtilTest {

    @DisplayName("normalize trims, lower-cases and strips display-name brackets")
    @Test
    void normalizeShouldProduceIdentityKey() {
        assertThat(EmailAddressUtil.normalize("  Ada@Example.COM ")).isEqualTo("ada@example.com");
        assertThat(EmailAddressUtil.normalize("Ada Lovelace <Ada@Example.com>")).isEqualTo("ada@example.com");
        assertThat(EmailAddressUtil.normalize("\"ada@example.com\"")).isEqualTo("ada@example.com");
        assertThat(EmailAddressUtil.normalize(null)).isEmpty();
    }

    @DisplayName("isValid accepts common addresses and rejects malformed ones")
    @Test
    void isValidShouldCheckSyntax() {
        assertThat(EmailAddressUtil.isValid("first.last+tag@sub.example.co")).isTrue();
        assertThat(EmailAddressUtil.isValid("no-at-sign.example.com")).isFalse();
        assertThat(EmailAddressUtil.isValid("user@localhost")).isFalse();
        assertThat(EmailAddressUtil.isValid("user@example.c")).isFalse();
        assertThat(EmailAddressUtil.isValid("")).isFalse();
        assertThat(EmailAddressUtil.isValid(null)).isFalse();
    }
}
