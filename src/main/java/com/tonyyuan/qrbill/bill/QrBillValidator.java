package com.tonyyuan.qrbill.bill;

import com.tonyyuan.qrbill.dto.AddressRequest;
import com.tonyyuan.qrbill.dto.QrBillRequest;
import com.tonyyuan.qrbill.dto.Violation;
import com.tonyyuan.qrbill.exception.QrBillErrorCode;
import com.tonyyuan.qrbill.exception.QrBillValidationException;
import com.tonyyuan.qrbill.util.IbanUtils;
import com.tonyyuan.qrbill.util.QrTextSanitizer;
import com.tonyyuan.qrbill.util.ReferenceUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Field validation for QR-bills.
 *
 * Two entry points share the same checks:
 *  - {@link #validate(QrBillRequest)}: fail-fast, throws on the first violation
 *    and otherwise returns the immutable {@link QrBill}.
 *  - {@link #collectViolations(QrBillRequest)}: runs every check and returns all
 *    problems at once, never throws.
 *
 * Order of checks: creditor account, creditor address, amount, currency,
 * reference (shape, pairing with the account, check digits), debtor, message.
 */
@Slf4j
public final class QrBillValidator {

    public static final BigDecimal AMOUNT_MIN = new BigDecimal("0.01");
    public static final BigDecimal AMOUNT_MAX = new BigDecimal("999999999.99");
    public static final Set<String> CURRENCIES = Collections.unmodifiableSet(new TreeSet<>(Arrays.asList("CHF", "EUR")));

    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Z]{2}$");

    private QrBillValidator() {
        // Utility class: prevent instantiation
    }

    /**
     * Validates and builds a bill, failing on the first violation.
     *
     * @throws QrBillValidationException describing the first invalid field.
     */
    public static QrBill validate(QrBillRequest request) {
        return new Run(violation -> {
            throw new QrBillValidationException(violation);
        }).build(request);
    }

    /**
     * Runs every check independently and gathers all violations.
     *
     * @return violations in check order; empty when the request is valid.
     */
    public static List<Violation> collectViolations(QrBillRequest request) {
        List<Violation> violations = new ArrayList<>();
        new Run(violations::add).build(request);
        return violations;
    }

    /**
     * One validation pass. Each check reports to the sink and returns the
     * cleaned value, or null when the field is invalid. The bill is only
     * assembled when no violation was reported.
     */
    private static final class Run {

        private final Consumer<Violation> sink;
        private boolean failed;

        Run(Consumer<Violation> sink) {
            this.sink = sink;
        }

        QrBill build(QrBillRequest request) {
            if (request == null) {
                report(QrBillErrorCode.MISSING_REQUIRED_FIELD, "request", "QR-bill data is required");
                return null;
            }

            String account = account(request.getCreditorAccount());
            AccountKind accountKind = account == null ? null : IbanUtils.classify(account);

            StructuredAddress creditor;
            if (request.getCreditor() == null) {
                report(QrBillErrorCode.MISSING_REQUIRED_FIELD, "creditor", "Creditor address is required");
                creditor = null;
            } else {
                creditor = address(request.getCreditor(), "creditor");
            }

            BigDecimal amount = amount(request.getAmount());
            String currency = currency(request.getCurrency());

            String reference = ReferenceUtils.normalize(request.getReference());
            ReferenceType referenceType = reference(reference, accountKind);

            StructuredAddress debtor = null;
            if (request.getDebtor() != null && !isBlank(request.getDebtor())) {
                debtor = address(request.getDebtor(), "debtor");
            }

            String message = QrTextSanitizer.sanitize(request.getMessage());
            maxLength(message, QrBill.MESSAGE_MAX, "message");

            if (failed) {
                return null;
            }
            log.debug("QR-bill validated: accountKind={}, referenceType={}", accountKind, referenceType);
            return new QrBill(account, accountKind, creditor, debtor, amount, currency,
                    reference, referenceType, message);
        }

        // ---------- Account ----------

        private String account(String raw) {
            String field = "creditorAccount";
            String iban = IbanUtils.normalize(raw);
            if (iban.isEmpty()) {
                report(QrBillErrorCode.MISSING_REQUIRED_FIELD, field, "Creditor IBAN is required");
                return null;
            }
            if (!IbanUtils.hasSupportedCountry(iban)) {
                report(QrBillErrorCode.INVALID_ACCOUNT_NUMBER, field, "IBAN must start with CH or LI");
                return null;
            }
            if (iban.length() != IbanUtils.IBAN_LENGTH) {
                report(QrBillErrorCode.INVALID_ACCOUNT_NUMBER, field,
                        "IBAN must be " + IbanUtils.IBAN_LENGTH + " characters long (without spaces)");
                return null;
            }
            if (!IbanUtils.isValid(iban)) {
                report(QrBillErrorCode.INVALID_ACCOUNT_NUMBER, field, "IBAN has invalid characters or check digits");
                return null;
            }
            return iban;
        }

        // ---------- Address ----------

        private StructuredAddress address(AddressRequest raw, String prefix) {
            String name = required(raw.getName(), StructuredAddress.NAME_MAX, prefix + ".name");
            String street = required(raw.getStreet(), StructuredAddress.STREET_MAX, prefix + ".street");
            String houseNumber = QrTextSanitizer.sanitize(raw.getHouseNumber());
            boolean houseNumberOk = maxLength(houseNumber, StructuredAddress.HOUSE_NUMBER_MAX, prefix + ".houseNumber");
            String postalCode = required(raw.getPostalCode(), StructuredAddress.POSTAL_CODE_MAX, prefix + ".postalCode");
            String city = required(raw.getCity(), StructuredAddress.CITY_MAX, prefix + ".city");
            String country = countryCode(raw.getCountryCode(), prefix + ".countryCode");

            if (name == null || street == null || !houseNumberOk || postalCode == null
                    || city == null || country == null) {
                return null;
            }
            return new StructuredAddress(name, street, houseNumber, postalCode, city, country);
        }

        private String countryCode(String raw, String field) {
            String country = QrTextSanitizer.sanitize(raw).toUpperCase(Locale.ROOT);
            if (country.isEmpty()) {
                report(QrBillErrorCode.MISSING_REQUIRED_FIELD, field, "Country code is required");
                return null;
            }
            if (!COUNTRY_CODE.matcher(country).matches()) {
                report(QrBillErrorCode.INVALID_COUNTRY_CODE, field,
                        "Country code must be a two-letter ISO code (e.g. \"CH\")");
                return null;
            }
            return country;
        }

        // ---------- Amount / currency ----------

        private BigDecimal amount(BigDecimal raw) {
            if (raw == null) {
                return null;
            }
            if (raw.compareTo(AMOUNT_MIN) < 0 || raw.compareTo(AMOUNT_MAX) > 0) {
                report(QrBillErrorCode.AMOUNT_OUT_OF_RANGE, "amount",
                        "Amount must be between " + AMOUNT_MIN + " and " + AMOUNT_MAX);
                return null;
            }
            return raw.setScale(2, RoundingMode.HALF_UP);
        }

        private String currency(String raw) {
            String currency = QrTextSanitizer.sanitize(raw);
            if (currency.isEmpty()) {
                return QrBill.DEFAULT_CURRENCY;
            }
            if (!CURRENCIES.contains(currency)) {
                report(QrBillErrorCode.UNSUPPORTED_CURRENCY, "currency", "Currency must be CHF or EUR");
                return null;
            }
            return currency;
        }

        // ---------- Reference ----------

        private ReferenceType reference(String reference, AccountKind accountKind) {
            String field = "reference";
            Optional<ReferenceType> classified = ReferenceUtils.classify(reference);
            if (!classified.isPresent()) {
                report(QrBillErrorCode.INVALID_REFERENCE_FORMAT, field,
                        "Reference must be a QR reference (27 digits) or a creditor reference (RF...)");
                return null;
            }
            ReferenceType type = classified.get();

            if (accountKind != null) {
                ReferencePairing pairing = ReferencePairing.of(accountKind, type);
                log.debug("Reference pairing: accountKind={}, referenceType={}, verdict={}",
                        accountKind, type, pairing);
                if (!pairing.isLegal()) {
                    report(QrBillErrorCode.ILLEGAL_ACCOUNT_REFERENCE_PAIRING, field, pairing.getMessage());
                    return null;
                }
            }

            if (!ReferenceUtils.hasValidCheckDigits(reference, type)) {
                report(QrBillErrorCode.INVALID_REFERENCE_CHECKSUM, field,
                        type == ReferenceType.QRR
                                ? "QR reference check digit is invalid"
                                : "Creditor reference check digits are invalid");
                return null;
            }
            return type;
        }

        // ---------- Helpers ----------

        private String required(String raw, int max, String field) {
            String value = QrTextSanitizer.sanitize(raw);
            if (value.isEmpty()) {
                report(QrBillErrorCode.MISSING_REQUIRED_FIELD, field, "Field is required");
                return null;
            }
            return maxLength(value, max, field) ? value : null;
        }

        private boolean maxLength(String value, int max, String field) {
            int length = value.codePointCount(0, value.length());
            if (length > max) {
                report(QrBillErrorCode.FIELD_TOO_LONG, field,
                        "Must be at most " + max + " characters, was " + length);
                return false;
            }
            return true;
        }

        private boolean isBlank(AddressRequest address) {
            return QrTextSanitizer.sanitize(address.getName()).isEmpty()
                    && QrTextSanitizer.sanitize(address.getStreet()).isEmpty()
                    && QrTextSanitizer.sanitize(address.getHouseNumber()).isEmpty()
                    && QrTextSanitizer.sanitize(address.getPostalCode()).isEmpty()
                    && QrTextSanitizer.sanitize(address.getCity()).isEmpty()
                    && QrTextSanitizer.sanitize(address.getCountryCode()).isEmpty();
        }

        private void report(QrBillErrorCode code, String field, String message) {
            failed = true;
            sink.accept(Violation.builder().code(code).field(field).message(message).build());
        }
    }
}
