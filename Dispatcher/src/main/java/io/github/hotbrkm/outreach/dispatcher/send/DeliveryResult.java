package io.github.hotbrkm.outreach.dispatcher.send;

/**
 * Result of a single transport call.
 */
public record DeliveryResult(boolean success, String reason) {
    private static final DeliveryResult SUCCESS = new DeliveryResult(true, null);

    public static DeliveryResult delivered() {
        return SUCCESS;
    }

    public static DeliveryResult failure(String reason) {
        return new DeliveryResult(false, reason == null || reason.isBlank() ? "unknown error" : reason);
    }
}
