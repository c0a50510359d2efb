package com.tonyyuan.qrbill.bill;

import com.tonyyuan.qrbill.dto.QrBillRequest;
import com.tonyyuan.qrbill.exception.QrBillValidationException;
import com.tonyyuan.qrbill.util.IbanUtils;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A fully validated, immutable QR-bill.
 *
 * Instances only come out of {@link #from(QrBillRequest)}, which either
 * returns a bill whose fields satisfy every rule of the payment standard
 * or throws {@link QrBillValidationException} on the first violation.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class QrBill {

    public static final String DEFAULT_CURRENCY = "CHF";
    public static final int MESSAGE_MAX = 140;

    /** IBAN without spaces. */
    private final String creditorAccount;
    private final AccountKind accountKind;
    private final StructuredAddress creditor;
    @Getter(AccessLevel.NONE)
    private final StructuredAddress debtor;
    @Getter(AccessLevel.NONE)
    private final BigDecimal amount;
    private final String currency;
    /** Reference without spaces, empty for {@link ReferenceType#NON}. */
    private final String reference;
    private final ReferenceType referenceType;
    /** Sanitized message, possibly empty. */
    private final String message;

    QrBill(String creditorAccount, AccountKind accountKind, StructuredAddress creditor,
           StructuredAddress debtor, BigDecimal amount, String currency,
           String reference, ReferenceType referenceType, String message) {
        this.creditorAccount = creditorAccount;
        this.accountKind = accountKind;
        this.creditor = creditor;
        this.debtor = debtor;
        this.amount = amount;
        this.currency = currency;
        this.reference = reference;
        this.referenceType = referenceType;
        this.message = message;
    }

    /**
     * Validates the request and builds the bill.
     *
     * @throws QrBillValidationException on the first invalid field.
     */
    public static QrBill from(QrBillRequest request) {
        return QrBillValidator.validate(request);
    }

    public Optional<StructuredAddress> getDebtor() {
        return Optional.ofNullable(debtor);
    }

    /** @return amount with exactly two fraction digits, if the bill has one */
    public Optional<BigDecimal> getAmount() {
        return Optional.ofNullable(amount);
    }

    /** @return creditor account grouped for display, e.g. "CH93 0076 2011 6238 5295 7" */
    public String getFormattedCreditorAccount() {
        return IbanUtils.format(creditorAccount);
    }
}
