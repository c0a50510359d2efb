package com.tonyyuan.qrbill.exception;

import com.tonyyuan.qrbill.dto.Violation;

/**
 * Thrown when a QR-bill cannot be constructed from the caller's input.
 *
 * Purpose:
 *  - Aborts construction on the first invalid field (fail-fast).
 *  - Carries the error code and the path of the offending field
 *    (e.g. "creditor.city") so callers can point at it.
 */
public class QrBillValidationException extends RuntimeException {

    private final QrBillErrorCode code;
    private final String field;

    public QrBillValidationException(QrBillErrorCode code, String field, String message) {
        super(field + ": " + message);
        this.code = code;
        this.field = field;
    }

    public QrBillValidationException(Violation violation) {
        this(violation.getCode(), violation.getField(), violation.getMessage());
    }

    /** @return the kind of violation */
    public QrBillErrorCode getCode() {
        return code;
    }

    /** @return dotted path of the rejected field */
    public String getField() {
        return field;
    }
}
