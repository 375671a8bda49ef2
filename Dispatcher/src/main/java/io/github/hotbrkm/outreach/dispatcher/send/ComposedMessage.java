package io.github.hotbrkm.outreach.dispatcher.send;

/**
 * Personalized subject and body, plus a label of the template they came from (e.g. {@code Template 2}).
 */
public record ComposedMessage(String subject, String body, String templateUsed) {
}
