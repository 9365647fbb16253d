package uk.gegc.vidstream.shared.util;

/**
 * Redaction helpers for values that must not appear verbatim in logs.
 */
public final class LogMasking {

    private LogMasking() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String maskEmail(String email) {
        if (email == null || email.isEmpty()) {
            return "***";
        }
        int atIndex = email.indexOf('@');
        if (atIndex <= 1) {
            return "***@" + (atIndex > 0 ? email.substring(atIndex + 1) : "***");
        }
        return email.charAt(0) + "***@" + email.substring(atIndex + 1);
    }

    public static String maskToken(String token) {
        if (token == null || token.length() <= 8) {
            return "***";
        }
        return token.substring(0, 4) + "..." + token.substring(token.length() - 4);
    }
}
