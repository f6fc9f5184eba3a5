package io.luascript.core.ir;

import java.math.BigInteger;

/**
 * Balanced base-3 codec used for node identifiers.
 *
 * <p>Digits are {@code T} (−1), {@code 0} and {@code 1}, most significant first. Unlike plain base-3
 * the encoding is total over signed integers without a sign symbol: {@code 0 → "0"}, {@code 2 →
 * "1T"}, {@code -1 → "T"}, {@code -4 → "TT"}. {@link #decode(String)} is the exact inverse of
 * {@link #encode(long)} over the whole {@code long} range.
 */
public final class BalancedTernary {

    /** Digit symbol for −1. */
    public static final char NEGATIVE_ONE = 'T';

    private static final BigInteger THREE = BigInteger.valueOf(3);

    private BalancedTernary() {
        // utility class
    }

    /**
     * Encodes {@code value} in balanced ternary.
     *
     * @param value any long, including negatives and the boundary values
     * @return the digit string, never empty
     */
    public static String encode(long value) {
        if (value == 0) {
            return "0";
        }
        StringBuilder digits = new StringBuilder();
        long n = value;
        while (n != 0) {
            // floorDiv keeps the remainder in 0..2 for negatives and cannot overflow
            long q = Math.floorDiv(n, 3);
            long r = n - q * 3;
            if (r == 0) {
                digits.append('0');
                n = q;
            } else if (r == 1) {
                digits.append('1');
                n = q;
            } else {
                digits.append(NEGATIVE_ONE);
                n = q + 1;
            }
        }
        return digits.reverse().toString();
    }

    /**
     * Decodes a balanced-ternary digit string.
     *
     * @param digits one or more of {@code T}, {@code 0}, {@code 1}
     * @return the decoded value
     * @throws IllegalArgumentException if the string is empty, contains another symbol, or does not
     *     fit in a {@code long}
     */
    public static long decode(String digits) {
        if (digits == null || digits.isEmpty()) {
            throw new IllegalArgumentException("balanced-ternary digits must not be empty");
        }
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < digits.length(); i++) {
            value = value.multiply(THREE).add(BigInteger.valueOf(digitValue(digits.charAt(i), digits)));
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("balanced-ternary value out of range: " + digits, e);
        }
    }

    /** Returns {@code true} if {@code digits} is a non-empty string over {@code T01}. */
    public static boolean isValid(String digits) {
        if (digits == null || digits.isEmpty()) {
            return false;
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c != NEGATIVE_ONE && c != '0' && c != '1') {
                return false;
            }
        }
        return true;
    }

    private static int digitValue(char c, String digits) {
        return switch (c) {
            case NEGATIVE_ONE -> -1;
            case '0' -> 0;
            case '1' -> 1;
            default -> throw new IllegalArgumentException(
                    "Invalid balanced-ternary digit '" + c + "' in \"" + digits + "\"");
        };
    }
}
