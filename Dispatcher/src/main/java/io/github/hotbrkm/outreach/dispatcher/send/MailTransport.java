package io.github.hotbrkm.outreach.dispatcher.send;

/**
 * Delivers one message. Implementations report failures through {@link DeliveryResult} instead of throwing.
 */
public interface MailTransport {

    DeliveryResult deliver(String from, String to, String subject, String body);

    /**
     * Checks that the relay accepts a connection and the configured credentials without sending anything.
     */
    default DeliveryResult verifyConnection() {
        return DeliveryResult.delivered();
    }
}
