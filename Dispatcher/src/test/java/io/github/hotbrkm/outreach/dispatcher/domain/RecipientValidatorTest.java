package io.github.hotbrkm.outreach.dispatcher.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RecipientValidator test")
class RecipientValidatorTest {

    private static Recipient.RecipientBuilder complete() {
        return Recipient.builder()
                .email("Grace@Navy.mil ")
                .firstName("Grace")
                .lastName("Hopper")
                .organization("US Navy");
    }

    @DisplayName("Complete recipient passes and its key is the normalized address")
    @Test
    void validRecipientShouldPass() {
        Recipient recipient = complete().build();

        assertThatCode(() -> RecipientValidator.validate(recipient)).doesNotThrowAnyException();
        assertThat(recipient.key()).isEqualTo("grace@navy.mil");
        assertThat(recipient.displayName()).isEqualTo("Grace Hopper");
    }

    @DisplayName("Invalid address is rejected with the offending key")
    @Test
    void invalidEmailShouldBeRejected() {
        Recipient recipient = complete().email("not-an-address").build();

        assertThatThrownBy(() -> RecipientValidator.validate(recipient))
                .isInstanceOf(RecipientValidationException.class)
                .hasMessageContaining("Invalid or missing email")
                .extracting(e -> ((RecipientValidationException) e).getRecipientKey())
                .isEqualTo("not-an-address");
    }

    @DisplayName("Missing name or organization is rejected")
    @Test
    void missingFieldsShouldBeRejected() {
        assertThatThrownBy(() -> RecipientValidator.validate(complete().firstName(" ").build()))
                .isInstanceOf(RecipientValidationException.class)
                .hasMessageContaining("first name");
        assertThatThrownBy(() -> RecipientValidator.validate(complete().organization(null).build()))
                .isInstanceOf(RecipientValidationException.class)
                .hasMessageContaining("organization");
        assertThatThrownBy(() -> RecipientValidator.validate(null))
                .isInstanceOf(RecipientValidationException.class);
    }

    @DisplayName("Recipients with the same normalized address are equal")
    @Test
    void equalityShouldFollowKey() {
        Recipient a = complete().build();
        Recipient b = complete().email("grace@navy.mil").firstName("G.").build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }
}
