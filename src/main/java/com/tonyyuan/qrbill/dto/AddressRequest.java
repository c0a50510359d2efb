package com.tonyyuan.qrbill.dto;

import lombok.*;

/**
 * Raw structured address (address type "S") as supplied by the caller.
 * Values are sanitized and validated when the bill is built.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddressRequest {

    /** Name or company, max 70 characters. */
    private String name;

    /** Street without house number, max 70 characters. */
    private String street;

    /** Optional house number, max 16 characters. */
    private String houseNumber;

    /** Postal code, max 16 characters. */
    private String postalCode;

    /** Town, max 35 characters. */
    private String city;

    /** Two-letter ISO 3166 country code. */
    private String countryCode;
}
