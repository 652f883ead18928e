package work.labs.witness.decode;

import java.math.BigInteger;

/**
 * Two's-complement helpers over MSB-first bit strings.
 */
public final class BitPatterns {
    private BitPatterns() {}

    public static BigInteger decode(String digits, boolean signed) {
        if (digits == null || digits.isEmpty() || !digits.chars().allMatch(c -> c == '0' || c == '1')) {
            throw new IllegalArgumentException("Not a bit pattern: " + digits);
        }
        BigInteger unsigned = new BigInteger(digits, 2);
        if (signed && digits.charAt(0) == '1') {
            return unsigned.subtract(BigInteger.ONE.shiftLeft(digits.length()));
        }
        return unsigned;
    }

    public static String encode(BigInteger value, int width) {
        String binary = value.mod(BigInteger.ONE.shiftLeft(width)).toString(2);
        return "0".repeat(width - binary.length()) + binary;
    }

    /**
     * Brings any integer into the range of a {@code width}-bit scalar by wrap-around.
     */
    public static BigInteger reduce(BigInteger value, int width, boolean signed) {
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        BigInteger wrapped = value.mod(modulus);
        if (signed && wrapped.testBit(width - 1)) {
            return wrapped.subtract(modulus);
        }
        return wrapped;
    }
}
