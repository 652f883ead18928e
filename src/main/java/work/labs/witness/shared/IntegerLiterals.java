package work.labs.witness.shared;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helper to parse C-style integer literals as printed by the backend
 * (e.g. {@code 42}, {@code -7}, {@code 200u}, {@code 18446744073709551615ul}, {@code 0x1F}).
 */
public final class IntegerLiterals {
    private IntegerLiterals() {}

    public static Optional<BigInteger> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = stripSuffix(raw.trim().toLowerCase(Locale.ROOT));
        boolean negative = false;
        if (trimmed.startsWith("-") || trimmed.startsWith("+")) {
            negative = trimmed.charAt(0) == '-';
            trimmed = trimmed.substring(1);
        }
        int radix = 10;
        if (trimmed.startsWith("0x")) {
            trimmed = trimmed.substring(2);
            radix = 16;
        }
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            BigInteger value = new BigInteger(trimmed, radix);
            return Optional.of(negative ? value.negate() : value);
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * Removes the {@code u}/{@code l} type suffixes; they carry no value information.
     */
    public static String stripSuffix(String literal) {
        int end = literal.length();
        while (end > 0) {
            char c = literal.charAt(end - 1);
            if (c != 'u' && c != 'l' && c != 'U' && c != 'L') {
                break;
            }
            end--;
        }
        return literal.substring(0, end);
    }
}
