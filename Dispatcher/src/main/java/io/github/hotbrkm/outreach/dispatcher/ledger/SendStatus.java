package io.github.hotbrkm.outreach.dispatcher.ledger;

import java.util.Locale;

/**
 * Final outcome of one send, after retries.
 */
public enum SendStatus {
    SENT("sent"),
    FAILED("failed");

    private final String code;

    SendStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static SendStatus fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Send status code must not be null");
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "sent" -> SENT;
            case "failed" -> FAILED;
            default -> throw new IllegalArgumentException("Unknown send status: " + code);
        };
    }
}
