package io.github.hotbrkm.outreach.dispatcher.domain;

import java.util.Locale;
import java.util.regex.Pattern;

public final class EmailAddressUtil {

    private static final Pattern ADDRESS_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private EmailAddressUtil() {}

    /**
     * Builds the identity key of an address: angle brackets and quotes removed, trimmed, lower-cased.
     *
     * @return normalized address, or an empty string for null/blank input
     */
    public static String normalize(String email) {
        if (email == null) {
            return "";
        }
        String addr = email.trim();
        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }
        if (addr.startsWith("\"") && addr.endsWith("\"") && addr.length() >= 2) {
            addr = addr.substring(1, addr.length() - 1).trim();
        }
        return addr.toLowerCase(Locale.ROOT);
    }

    /**
     * Basic syntactic check of an already normalized address.
     */
    public static boolean isValid(String email) {
        if (email == null || email.isEmpty()) {
            return false;
        }
        return ADDRESS_PATTERN.matcher(email).matches();
    }
}
