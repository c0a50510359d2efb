package com.tonyyuan.qrbill.dto;

import lombok.*;

import java.math.BigDecimal;

/**
 * Raw input for building a QR-bill.
 * Contains the creditor account and address, and the optional debtor,
 * amount, currency, reference and message.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QrBillRequest {

    /**
     * Creditor IBAN or QR-IBAN (CH/LI, 21 characters).
     * Spaces are allowed and removed.
     */
    private String creditorAccount;

    /** Creditor address (required). */
    private AddressRequest creditor;

    /** Debtor address (optional). */
    private AddressRequest debtor;

    /**
     * Amount, 0.01 to 999999999.99.
     * Absent means the debtor fills it in.
     */
    private BigDecimal amount;

    /** "CHF" or "EUR"; CHF if absent. */
    private String currency;

    /** QR reference (27 digits) or creditor reference (RF...), optional. */
    private String reference;

    /** Unstructured message, max 140 characters. */
    private String message;
}
