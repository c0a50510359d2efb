package com.tonyyuan.qrbill.util;

import com.tonyyuan.qrbill.bill.AccountKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IbanUtilsTest {

    @Test
    void classify_reservedBand_isQrIban() {
        assertThat(IbanUtils.classify("CH4431999123000889012")).isEqualTo(AccountKind.QR_IBAN);
        assertThat(IbanUtils.classify("CH9300762011623852957")).isEqualTo(AccountKind.IBAN);
    }

    @Test
    void classify_bandEdges() {
        assertThat(IbanUtils.classify("CH0030000000000000000")).isEqualTo(AccountKind.QR_IBAN);
        assertThat(IbanUtils.classify("CH0031999000000000000")).isEqualTo(AccountKind.QR_IBAN);
        assertThat(IbanUtils.classify("CH0029999000000000000")).isEqualTo(AccountKind.IBAN);
        assertThat(IbanUtils.classify("CH0032000000000000000")).isEqualTo(AccountKind.IBAN);
    }

    @Test
    void isValid_checksStructureAndChecksum() {
        assertThat(IbanUtils.isValid("CH9300762011623852957")).isTrue();
        assertThat(IbanUtils.isValid("LI21088100002324013AA")).isTrue();
        assertThat(IbanUtils.isValid("CH9300762011623852958")).isFalse();
        assertThat(IbanUtils.isValid("DE89370400440532013000")).isFalse();
        assertThat(IbanUtils.isValid("CH93007620116238529")).isFalse();
    }

    @Test
    void isValid_lettersInInstitutionId_areRejected() {
        String account = Mod97Checksum.appendCheckDigits("CH", "A0762011623852957");
        assertThat(account).isEqualTo("CH37A0762011623852957");
        assertThat(Mod97Checksum.isValid(account)).isTrue();

        assertThat(IbanUtils.isValid(account)).isFalse();
        assertThat(IbanUtils.isQrIban(account)).isFalse();
    }

    @Test
    void isQrIban_isLenient() {
        assertThat(IbanUtils.isQrIban("CH44 3199 9123 0008 8901 2")).isTrue();
        assertThat(IbanUtils.isQrIban("CH9300762011623852957")).isFalse();
        assertThat(IbanUtils.isQrIban("garbage")).isFalse();
        assertThat(IbanUtils.isQrIban(null)).isFalse();
    }

    @Test
    void format_groupsByFour() {
        assertThat(IbanUtils.format("CH9300762011623852957")).isEqualTo("CH93 0076 2011 6238 5295 7");
        assertThat(IbanUtils.format("CH93 0076 2011 6238 5295 7")).isEqualTo("CH93 0076 2011 6238 5295 7");
    }
}
