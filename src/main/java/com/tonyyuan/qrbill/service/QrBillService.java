package com.tonyyuan.qrbill.service;

import com.tonyyuan.qrbill.bill.QrBill;
import com.tonyyuan.qrbill.bill.QrBillValidator;
import com.tonyyuan.qrbill.bill.ReferenceType;
import com.tonyyuan.qrbill.dto.QrBillRequest;
import com.tonyyuan.qrbill.dto.Violation;
import com.tonyyuan.qrbill.exception.QrBillValidationException;
import com.tonyyuan.qrbill.util.ReferenceUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * QR-bill domain service.
 *
 * Responsibilities:
 *  - Builds validated bills from raw requests (fail-fast).
 *  - Produces the Swiss Payment Code payload handed to the QR renderer.
 *  - Offers a non-throwing pre-check listing every problem of a request,
 *    e.g. for showing all form errors at once.
 *  - Generates QR references from invoice numbers.
 *
 * Notes:
 *  - Stateless; safe to call from any number of threads.
 *  - Names, addresses and messages are never logged, the IBAN only in display form.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QrBillService {

    private final SwissPaymentCodeSerializer serializer;

    /**
     * Validates the request and builds the bill.
     *
     * @throws QrBillValidationException on the first invalid field.
     */
    public QrBill create(QrBillRequest request) {
        try {
            QrBill bill = QrBill.from(request);
            log.info("[QRBILL] Created. account={}, accountKind={}, referenceType={}",
                    bill.getFormattedCreditorAccount(), bill.getAccountKind(), bill.getReferenceType());
            return bill;
        } catch (QrBillValidationException ex) {
            log.warn("[QRBILL] Rejected: code={}, field={}", ex.getCode(), ex.getField());
            throw ex;
        }
    }

    /**
     * Validates the request and returns its payment code payload.
     *
     * @throws QrBillValidationException on the first invalid field.
     */
    public String generatePayload(QrBillRequest request) {
        return serializer.serialize(create(request));
    }

    /**
     * Payload of an already constructed bill.
     */
    public String generatePayload(QrBill bill) {
        return serializer.serialize(bill);
    }

    /**
     * Reference type of a constructed bill (QRR, SCOR or NON), as needed by renderers.
     */
    public ReferenceType referenceTypeOf(QrBill bill) {
        return bill.getReferenceType();
    }

    /**
     * Lists all problems of a request without throwing.
     *
     * @return empty list when {@link #create(QrBillRequest)} would succeed.
     */
    public List<Violation> precheck(QrBillRequest request) {
        List<Violation> violations = QrBillValidator.collectViolations(request);
        log.debug("[QRBILL] Pre-check found {} violation(s)", violations.size());
        return violations;
    }

    /**
     * Generates a QR reference from an invoice number or any other seed.
     *
     * @throws IllegalArgumentException if the seed holds more than 26 digits.
     */
    public String generateQrReference(String seed) {
        return ReferenceUtils.generateQrReference(seed);
    }
}
