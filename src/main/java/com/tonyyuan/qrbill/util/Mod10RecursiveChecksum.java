package com.tonyyuan.qrbill.util;

/**
 * Modulo 10 recursive check digit used by the 27-digit QR reference.
 *
 * Each digit advances a carry through a fixed table:
 * {@code carry = TABLE[(carry + digit) % 10]}. The check digit is
 * {@code (10 - carry) % 10} of the final carry.
 */
public final class Mod10RecursiveChecksum {

    private static final int[] TABLE = {0, 9, 4, 6, 8, 2, 7, 1, 3, 5};

    private Mod10RecursiveChecksum() {
        // Utility class: prevent instantiation
    }

    /**
     * @param digits payload digits, without check digit.
     * @return the check digit (0-9).
     * @throws IllegalArgumentException if a non-digit is present.
     */
    public static int computeCheckDigit(String digits) {
        int carry = 0;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Not a digit at index " + i + ": '" + c + "'");
            }
            carry = TABLE[(carry + (c - '0')) % 10];
        }
        return (10 - carry) % 10;
    }

    /**
     * @return {@code digits} followed by its check digit.
     */
    public static String appendCheckDigit(String digits) {
        return digits + computeCheckDigit(digits);
    }

    /**
     * Recomputes the check digit over all but the last digit and compares.
     *
     * @param digitsWithCheck digits, check digit last.
     * @return false for null, empty or non-numeric input.
     */
    public static boolean isValid(String digitsWithCheck) {
        if (digitsWithCheck == null || digitsWithCheck.length() < 2) {
            return false;
        }
        int last = digitsWithCheck.length() - 1;
        char check = digitsWithCheck.charAt(last);
        if (check < '0' || check > '9') {
            return false;
        }
        try {
            return computeCheckDigit(digitsWithCheck.substring(0, last)) == check - '0';
        } catch (IllegalArgumentException notNumeric) {
            return false;
        }
    }
}
