package com.tonyyuan.qrbill.util;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Mod97Checksum} and {@link Mod10RecursiveChecksum}.
 */
class ChecksumTest {

    // ============ Mod 97 ============

    @Test
    void mod97_knownIbans() {
        assertThat(Mod97Checksum.isValid("CH9300762011623852957")).isTrue();
        assertThat(Mod97Checksum.isValid("CH4431999123000889012")).isTrue();
        assertThat(Mod97Checksum.isValid("LI21088100002324013AA")).isTrue();
        assertThat(Mod97Checksum.isValid("CH9300762011623852958")).isFalse();
    }

    @Test
    void mod97_computesIbanCheckDigits() {
        assertThat(Mod97Checksum.computeCheckDigits("CH", "00762011623852957")).isEqualTo("93");
        assertThat(Mod97Checksum.computeCheckDigits("RF", "539007547034")).isEqualTo("18");
    }

    @Test
    void mod97_longIdentifier_doesNotOverflow() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 200; i++) body.append('9');
        String full = Mod97Checksum.appendCheckDigits("RF", body.toString());
        assertThat(Mod97Checksum.isValid(full)).isTrue();
    }

    @Test
    void mod97_roundTrip_randomDigitStrings() {
        Random rnd = new Random(97);
        for (int n = 0; n < 200; n++) {
            String digits = randomDigits(rnd, 1 + rnd.nextInt(40));
            assertThat(Mod97Checksum.isValid(Mod97Checksum.appendCheckDigits("RF", digits)))
                    .as(digits).isTrue();
        }
    }

    @Test
    void mod97_rejectsNonAlphanumeric() {
        assertThat(Mod97Checksum.isValid("CH93-0762011623852957")).isFalse();
        assertThat(Mod97Checksum.isValid("CH9")).isFalse();
        assertThatThrownBy(() -> Mod97Checksum.remainder("12ü"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ============ Mod 10 recursive ============

    @Test
    void mod10_knownQrReferences() {
        assertThat(Mod10RecursiveChecksum.isValid("210000000003139471430009017")).isTrue();
        assertThat(Mod10RecursiveChecksum.isValid("000000000000000000012345676")).isTrue();
        assertThat(Mod10RecursiveChecksum.isValid("000000000000000000012345679")).isFalse();
    }

    @Test
    void mod10_fullTableForSingleDigits() {
        // Check digit of a single digit d is (10 - TABLE[d]) % 10
        int[] expected = {0, 1, 6, 4, 2, 8, 3, 9, 7, 5};
        for (int d = 0; d <= 9; d++) {
            assertThat(Mod10RecursiveChecksum.computeCheckDigit(String.valueOf(d))).as("digit %d", d)
                    .isEqualTo(expected[d]);
        }
    }

    @Test
    void mod10_carryChainsThroughEveryState() {
        // Carry after "1" is 9; then (9 + d) % 10 selects every table entry
        int[] expected = {5, 0, 1, 6, 4, 2, 8, 3, 9, 7};
        for (int d = 0; d <= 9; d++) {
            assertThat(Mod10RecursiveChecksum.computeCheckDigit("1" + d)).as("1%d", d)
                    .isEqualTo(expected[d]);
        }
    }

    @Test
    void mod10_roundTrip_random26DigitPayloads() {
        Random rnd = new Random(10);
        for (int n = 0; n < 200; n++) {
            String digits = randomDigits(rnd, 26);
            assertThat(Mod10RecursiveChecksum.isValid(Mod10RecursiveChecksum.appendCheckDigit(digits)))
                    .as(digits).isTrue();
        }
    }

    @Test
    void mod10_rejectsNonDigits() {
        assertThat(Mod10RecursiveChecksum.isValid("12a4")).isFalse();
        assertThat(Mod10RecursiveChecksum.isValid("")).isFalse();
        assertThatThrownBy(() -> Mod10RecursiveChecksum.computeCheckDigit("1x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------- Helpers ----------

    private static String randomDigits(Random rnd, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) sb.append((char) ('0' + rnd.nextInt(10)));
        return sb.toString();
    }
}
