package com.tonyyuan.qrbill.util;

/**
 * ISO 7064 MOD 97-10 check digits, as used by IBANs (ISO 13616)
 * and creditor references (ISO 11649).
 *
 * Identifiers are laid out as {@code <prefix (2 letters)><check (2 digits)><body>}.
 * Validation moves the first four characters to the end, maps letters to
 * 10..35 and expects the resulting number mod 97 to equal 1.
 *
 * The remainder is computed left-to-right, carrying only the running
 * remainder, so identifiers of any length never overflow.
 */
public final class Mod97Checksum {

    private Mod97Checksum() {
        // Utility class: prevent instantiation
    }

    /**
     * Remainder mod 97 of the numeric form of an alphanumeric string.
     * Letters count as two digits (A=10 ... Z=35).
     *
     * @param value ASCII letters and digits only.
     * @return value mod 97.
     * @throws IllegalArgumentException on any other character.
     */
    public static int remainder(CharSequence value) {
        int remainder = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            int v = c < 0x80 ? Character.digit(c, 36) : -1;
            if (v < 0) {
                throw new IllegalArgumentException("Not alphanumeric at index " + i + ": '" + c + "'");
            }
            remainder = v < 10 ? (remainder * 10 + v) % 97 : (remainder * 100 + v) % 97;
        }
        return remainder;
    }

    /**
     * Computes the two check digits for {@code prefix + ?? + body}.
     *
     * @param prefix two-letter prefix (country code or "RF").
     * @param body   characters following the check digits.
     * @return check digits, always two characters ("02".."98").
     */
    public static String computeCheckDigits(String prefix, String body) {
        int check = 98 - remainder(body + prefix + "00");
        return check < 10 ? "0" + check : Integer.toString(check);
    }

    /**
     * Builds {@code prefix + checkDigits + body}.
     */
    public static String appendCheckDigits(String prefix, String body) {
        return prefix + computeCheckDigits(prefix, body) + body;
    }

    /**
     * Validates an identifier carrying its check digits at positions 3-4.
     *
     * @param value full identifier, no whitespace.
     * @return true if the rearranged identifier mod 97 equals 1;
     *         false if too short or not alphanumeric.
     */
    public static boolean isValid(String value) {
        if (value == null || value.length() < 5) {
            return false;
        }
        String rearranged = value.substring(4) + value.substring(0, 4);
        try {
            return remainder(rearranged) == 1;
        } catch (IllegalArgumentException notAlphanumeric) {
            return false;
        }
    }
}
