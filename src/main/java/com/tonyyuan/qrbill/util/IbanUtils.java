package com.tonyyuan.qrbill.util;

import com.tonyyuan.qrbill.bill.AccountKind;

import java.util.regex.Pattern;

/**
 * Helpers for the creditor account (Swiss/Liechtenstein IBAN).
 *
 * Features:
 *  - Normalization (whitespace removal).
 *  - Structural + mod 97 validation.
 *  - QR-IBAN detection from the institution identifier (IID).
 *  - Display grouping in blocks of four.
 *
 * ⚠️ Grouped form is for display only, never for the payment code itself.
 */
public final class IbanUtils {

    /** Length of CH/LI IBANs. */
    public static final int IBAN_LENGTH = 21;

    /** Closed band of IIDs reserved for QR-IBANs. */
    public static final int QR_IID_MIN = 30000;
    public static final int QR_IID_MAX = 31999;

    private static final Pattern SHAPE = Pattern.compile("^(CH|LI)\\d{7}[0-9A-Z]{12}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IbanUtils() {
        // Utility class: prevent instantiation
    }

    /**
     * Removes all whitespace, so grouped input ("CH93 0076 ...") is accepted.
     */
    public static String normalize(String iban) {
        return iban == null ? "" : WHITESPACE.matcher(iban).replaceAll("");
    }

    /**
     * @return true if the (normalized) value starts with a supported country code.
     */
    public static boolean hasSupportedCountry(String iban) {
        return iban.startsWith("CH") || iban.startsWith("LI");
    }

    /**
     * Full structural and checksum validation of a normalized IBAN.
     * Check digits and the five-digit IID must be numeric.
     */
    public static boolean isValid(String iban) {
        return iban != null && SHAPE.matcher(iban).matches() && Mod97Checksum.isValid(iban);
    }

    /**
     * Classifies a structurally valid IBAN by its IID (characters 5-9).
     *
     * @param iban normalized IBAN of {@link #IBAN_LENGTH} characters.
     * @return {@link AccountKind#QR_IBAN} inside the reserved band, else {@link AccountKind#IBAN}.
     */
    public static AccountKind classify(String iban) {
        int iid = Integer.parseInt(iban.substring(4, 9));
        return iid >= QR_IID_MIN && iid <= QR_IID_MAX ? AccountKind.QR_IBAN : AccountKind.IBAN;
    }

    /**
     * Lenient QR-IBAN check for arbitrary input.
     *
     * @return false for anything that is not a valid CH/LI IBAN.
     */
    public static boolean isQrIban(String iban) {
        String normalized = normalize(iban);
        return isValid(normalized) && classify(normalized) == AccountKind.QR_IBAN;
    }

    /**
     * Groups an IBAN in blocks of four for display.
     *
     * Example:
     *  - Input:  CH9300762011623852957
     *  - Output: CH93 0076 2011 6238 5295 7
     */
    public static String format(String iban) {
        String normalized = normalize(iban);
        StringBuilder sb = new StringBuilder(normalized.length() + normalized.length() / 4);
        for (int i = 0; i < normalized.length(); i++) {
            if (i > 0 && i % 4 == 0) {
                sb.append(' ');
            }
            sb.append(normalized.charAt(i));
        }
        return sb.toString();
    }
}
