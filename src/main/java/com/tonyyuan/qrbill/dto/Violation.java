package com.tonyyuan.qrbill.dto;

import com.tonyyuan.qrbill.exception.QrBillErrorCode;
import lombok.*;

/**
 * One problem found in a {@link QrBillRequest}.
 */
@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Violation {

    private final QrBillErrorCode code;  // Kind of problem
    private final String field;          // Dotted field path, e.g. "debtor.postalCode"
    private final String message;        // Human-readable description
}
