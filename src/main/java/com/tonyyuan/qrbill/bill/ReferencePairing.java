package com.tonyyuan.qrbill.bill;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Verdict for every (account kind, reference type) combination.
 *
 * Legal: QR-IBAN with QRR, IBAN with SCOR, IBAN without reference.
 * Each illegal combination has its own message.
 */
@Getter
@RequiredArgsConstructor
public enum ReferencePairing {

    OK(null),

    QR_IBAN_WITHOUT_QR_REFERENCE(
            "A QR-IBAN requires a QR reference (27 digits). Use a regular IBAN if no reference is needed."),

    QR_IBAN_WITH_CREDITOR_REFERENCE(
            "A creditor reference (RF...) cannot be used with a QR-IBAN. Use a QR reference or a regular IBAN."),

    IBAN_WITH_QR_REFERENCE(
            "A QR reference (27 digits) can only be used with a QR-IBAN. Use a creditor reference (RF...) or no reference.");

    private final String message;

    public boolean isLegal() {
        return this == OK;
    }

    /**
     * Total mapping of account kind x reference type to a verdict.
     */
    public static ReferencePairing of(AccountKind account, ReferenceType reference) {
        switch (account) {
            case QR_IBAN:
                switch (reference) {
                    case QRR:
                        return OK;
                    case SCOR:
                        return QR_IBAN_WITH_CREDITOR_REFERENCE;
                    case NON:
                    default:
                        return QR_IBAN_WITHOUT_QR_REFERENCE;
                }
            case IBAN:
            default:
                return reference == ReferenceType.QRR ? IBAN_WITH_QR_REFERENCE : OK;
        }
    }
}
