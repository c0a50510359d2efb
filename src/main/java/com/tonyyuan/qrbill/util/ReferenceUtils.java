package com.tonyyuan.qrbill.util;

import com.tonyyuan.qrbill.bill.ReferenceType;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Helpers for payment references.
 *
 * Supports:
 *  - QRR  (27 digits, last digit is the modulo 10 recursive check digit)
 *  - SCOR (ISO 11649: "RF" + 2 check digits + 1-21 upper-case letters/digits)
 *
 * Classification only looks at the shape; check digits are verified
 * separately by {@link #hasValidCheckDigits(String, ReferenceType)}.
 */
public final class ReferenceUtils {

    public static final int QR_REFERENCE_LENGTH = 27;
    public static final String CREDITOR_REFERENCE_PREFIX = "RF";
    public static final int CREDITOR_REFERENCE_MAX_BODY = 21;

    private static final Pattern QRR_SHAPE = Pattern.compile("^\\d{27}$");
    private static final Pattern SCOR_SHAPE = Pattern.compile("^RF\\d{2}[A-Z0-9]{1,21}$");
    private static final Pattern BODY_SHAPE = Pattern.compile("^[A-Z0-9]{1,21}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private ReferenceUtils() {
        // Utility class: prevent instantiation
    }

    /**
     * Removes all whitespace and upper-cases, so grouped or lower-case
     * input ("rf18 5390 ...") is accepted.
     */
    public static String normalize(String reference) {
        return reference == null ? "" : WHITESPACE.matcher(reference).replaceAll("").toUpperCase(Locale.ROOT);
    }

    /**
     * Classifies a normalized reference by its shape.
     *
     * @return NON for empty input, QRR or SCOR when the shape matches,
     *         empty when the reference matches neither shape.
     */
    public static Optional<ReferenceType> classify(String reference) {
        if (reference == null || reference.isEmpty()) {
            return Optional.of(ReferenceType.NON);
        }
        if (QRR_SHAPE.matcher(reference).matches()) {
            return Optional.of(ReferenceType.QRR);
        }
        if (SCOR_SHAPE.matcher(reference).matches()) {
            return Optional.of(ReferenceType.SCOR);
        }
        return Optional.empty();
    }

    /**
     * Recomputes the embedded check digit(s) for an already classified reference.
     */
    public static boolean hasValidCheckDigits(String reference, ReferenceType type) {
        switch (type) {
            case QRR:
                return Mod10RecursiveChecksum.isValid(reference);
            case SCOR:
                return Mod97Checksum.isValid(reference);
            case NON:
            default:
                return true;
        }
    }

    /**
     * Generates a QR reference from any seed (e.g. an invoice number).
     *
     * Only the digits of the seed are kept; they are left-padded with zeros
     * to 26 digits and the check digit is appended.
     *
     * Example:
     *  - Input:  "RE-2024-0042"
     *  - Output: "000000000000000000202400426"
     *
     * @param seed any text, may be null.
     * @return a valid 27-digit QR reference.
     * @throws IllegalArgumentException if the seed holds more than 26 digits.
     */
    public static String generateQrReference(String seed) {
        String digits = seed == null ? "" : NON_DIGITS.matcher(seed).replaceAll("");
        int payloadLength = QR_REFERENCE_LENGTH - 1;
        if (digits.length() > payloadLength) {
            throw new IllegalArgumentException(
                    "Seed contains " + digits.length() + " digits, at most " + payloadLength + " allowed");
        }
        StringBuilder padded = new StringBuilder(payloadLength);
        for (int i = digits.length(); i < payloadLength; i++) {
            padded.append('0');
        }
        padded.append(digits);
        return Mod10RecursiveChecksum.appendCheckDigit(padded.toString());
    }

    /**
     * Generates an ISO 11649 creditor reference.
     *
     * @param body 1-21 letters/digits, whitespace ignored; upper-cased.
     * @return "RF" + check digits + body.
     * @throws IllegalArgumentException for an empty, too long or non-alphanumeric body.
     */
    public static String generateCreditorReference(String body) {
        String normalized = normalize(body);
        if (!BODY_SHAPE.matcher(normalized).matches()) {
            throw new IllegalArgumentException(
                    "Creditor reference body must be 1-" + CREDITOR_REFERENCE_MAX_BODY + " letters or digits");
        }
        return Mod97Checksum.appendCheckDigits(CREDITOR_REFERENCE_PREFIX, normalized);
    }

    /**
     * Groups a QR reference in blocks of five for display.
     */
    public static String formatQrReference(String reference) {
        String normalized = normalize(reference);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < normalized.length(); i++) {
            if (i > 0 && i % 5 == 0) {
                sb.append(' ');
            }
            sb.append(normalized.charAt(i));
        }
        return sb.toString();
    }
}
