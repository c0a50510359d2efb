package com.tonyyuan.qrbill.exception;

/**
 * Reasons a QR-bill cannot be built.
 */
public enum QrBillErrorCode {
    MISSING_REQUIRED_FIELD,
    FIELD_TOO_LONG,
    INVALID_COUNTRY_CODE,
    INVALID_ACCOUNT_NUMBER,
    INVALID_REFERENCE_FORMAT,
    INVALID_REFERENCE_CHECKSUM,
    ILLEGAL_ACCOUNT_REFERENCE_PAIRING,
    AMOUNT_OUT_OF_RANGE,
    UNSUPPORTED_CURRENCY
}
