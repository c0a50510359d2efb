package com.tonyyuan.qrbill.service;

import com.tonyyuan.qrbill.bill.QrBill;
import com.tonyyuan.qrbill.bill.StructuredAddress;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes a {@link QrBill} as the Swiss Payment Code (SPC) text payload.
 *
 * Layout (Swiss Payment Standards, version 0200, address type "S" only):
 *  -  1-3   header: "SPC", "0200", "1"
 *  -  4     creditor IBAN, no spaces
 *  -  5-11  creditor: "S", name, street, house number, postal code, city, country
 *  - 12-18  ultimate creditor, always empty
 *  - 19-20  amount (two decimals, or empty), currency
 *  - 21-27  debtor: "S" + 6 fields, or 7 empty lines without debtor
 *  - 28-29  reference type token, reference
 *  - 30     unstructured message
 *  - 31     trailer "EPD"
 *  - 32-33  alternative procedures, always empty
 *
 * Lines are joined with CRLF, without a trailing separator.
 * The bill is trusted: no cleaning or validation happens here.
 */
@Component
public class SwissPaymentCodeSerializer {

    public static final String QR_TYPE = "SPC";
    public static final String VERSION = "0200";
    public static final String CODING_TYPE = "1";
    public static final String ADDRESS_TYPE_STRUCTURED = "S";
    public static final String TRAILER = "EPD";
    public static final String SEPARATOR = "\r\n";
    public static final int LINE_COUNT = 33;

    private static final int ADDRESS_BLOCK_LINES = 7;

    /**
     * @param bill a successfully constructed bill.
     * @return the 33-line payload.
     */
    public String serialize(QrBill bill) {
        List<String> lines = new ArrayList<>(LINE_COUNT);

        // Header
        lines.add(QR_TYPE);
        lines.add(VERSION);
        lines.add(CODING_TYPE);

        // Creditor
        lines.add(bill.getCreditorAccount());
        addAddress(lines, bill.getCreditor());

        // Ultimate creditor (reserved)
        addEmpty(lines, ADDRESS_BLOCK_LINES);

        // Payment amount
        lines.add(bill.getAmount().map(BigDecimal::toPlainString).orElse(""));
        lines.add(bill.getCurrency());

        // Ultimate debtor
        Optional<StructuredAddress> debtor = bill.getDebtor();
        if (debtor.isPresent()) {
            addAddress(lines, debtor.get());
        } else {
            addEmpty(lines, ADDRESS_BLOCK_LINES);
        }

        // Payment reference
        lines.add(bill.getReferenceType().getToken());
        lines.add(bill.getReference());

        // Additional information
        lines.add(bill.getMessage());
        lines.add(TRAILER);

        // Alternative procedures
        addEmpty(lines, 2);

        return String.join(SEPARATOR, lines);
    }

    private static void addAddress(List<String> lines, StructuredAddress address) {
        lines.add(ADDRESS_TYPE_STRUCTURED);
        lines.add(address.getName());
        lines.add(address.getStreet());
        lines.add(address.getHouseNumber());
        lines.add(address.getPostalCode());
        lines.add(address.getCity());
        lines.add(address.getCountryCode());
    }

    private static void addEmpty(List<String> lines, int count) {
        for (int i = 0; i < count; i++) {
            lines.add("");
        }
    }
}
