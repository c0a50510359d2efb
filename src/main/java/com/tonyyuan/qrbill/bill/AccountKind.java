package com.tonyyuan.qrbill.bill;

/**
 * Kind of creditor account, decided by the institution identifier (IID)
 * at positions 5-9 of a Swiss/Liechtenstein IBAN.
 */
public enum AccountKind {

    /** QR-IBAN: IID in the reserved band 30000-31999. Requires a QR reference. */
    QR_IBAN,

    /** Regular IBAN. Takes a creditor reference or no reference. */
    IBAN
}
