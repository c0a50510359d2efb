package com.tonyyuan.qrbill.util;

/**
 * Reduces free text to the character subset allowed in a Swiss payment code.
 *
 * Allowed ranges:
 *  - 0x20-0x7E: printable ASCII.
 *  - 0xA0-0xFF: Latin-1 supplement (umlauts, accents, ...).
 *
 * Steps:
 *  1) Every line-break sequence (CRLF, LF, CR, NEL, LS, PS) becomes a space.
 *  2) Every code point outside the allowed ranges becomes a single space.
 *  3) Runs of spaces (including no-break spaces) collapse to one space.
 *  4) Leading and trailing spaces are trimmed.
 *
 * The result never contains control characters or line breaks and
 * sanitizing a sanitized string returns it unchanged.
 */
public final class QrTextSanitizer {

    private static final char NO_BREAK_SPACE = '\u00A0';

    private QrTextSanitizer() {
        // Utility class: prevent instantiation
    }

    /**
     * Sanitizes raw caller text.
     *
     * @param raw text to clean, may be null.
     * @return cleaned text, empty string for null input.
     */
    public static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        StringBuilder out = new StringBuilder(raw.length());
        boolean pendingSpace = false;

        int i = 0;
        while (i < raw.length()) {
            int cp = raw.codePointAt(i);
            i += Character.charCount(cp);

            if (cp == '\r' && i < raw.length() && raw.charAt(i) == '\n') {
                i++; // CRLF counts as one break
            }

            if (isLineBreak(cp) || !isAllowed(cp) || cp == ' ' || cp == NO_BREAK_SPACE) {
                pendingSpace = true;
                continue;
            }

            // Leading spaces are dropped, inner runs become exactly one space
            if (pendingSpace && out.length() > 0) {
                out.append(' ');
            }
            pendingSpace = false;
            out.appendCodePoint(cp);
        }
        return out.toString();
    }

    /**
     * @return true if the code point may appear in a payment code field.
     */
    public static boolean isAllowed(int codePoint) {
        return (codePoint >= 0x20 && codePoint <= 0x7E) || (codePoint >= 0xA0 && codePoint <= 0xFF);
    }

    private static boolean isLineBreak(int cp) {
        return cp == '\n' || cp == '\r' || cp == 0x0B || cp == 0x0C
                || cp == 0x85 || cp == 0x2028 || cp == 0x2029;
    }
}
