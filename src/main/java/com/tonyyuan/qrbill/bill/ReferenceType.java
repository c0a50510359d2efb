package com.tonyyuan.qrbill.bill;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reference kinds of the payment code, with the token written to line 28.
 */
@Getter
@RequiredArgsConstructor
public enum ReferenceType {

    /** 27-digit QR reference with a modulo 10 recursive check digit. */
    QRR("QRR"),

    /** ISO 11649 creditor reference: "RF", two mod 97 check digits, up to 21 characters. */
    SCOR("SCOR"),

    /** No reference. */
    NON("NON");

    private final String token;
}
