package com.tonyyuan.qrbill.bill;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Validated structured address (address type "S").
 * All values are sanitized; an absent house number is the empty string.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class StructuredAddress {

    public static final int NAME_MAX = 70;
    public static final int STREET_MAX = 70;
    public static final int HOUSE_NUMBER_MAX = 16;
    public static final int POSTAL_CODE_MAX = 16;
    public static final int CITY_MAX = 35;

    private final String name;
    private final String street;
    private final String houseNumber;
    private final String postalCode;
    private final String city;
    private final String countryCode;

    StructuredAddress(String name, String street, String houseNumber,
                      String postalCode, String city, String countryCode) {
        this.name = name;
        this.street = street;
        this.houseNumber = houseNumber;
        this.postalCode = postalCode;
        this.city = city;
        this.countryCode = countryCode;
    }
}
