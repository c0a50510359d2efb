package com.tonyyuan.qrbill.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QrTextSanitizerTest {

    @Test
    void emojiAndNewline_areReplacedAndCollapsed() {
        assertThat(QrTextSanitizer.sanitize("Test 🎉 Company\nLine2")).isEqualTo("Test Company Line2");
    }

    @Test
    void allLineBreakForms_areRemoved() {
        String out = QrTextSanitizer.sanitize("a\r\nb\rc\nd e\u0085f");
        assertThat(out).isEqualTo("a b c d e f");
        assertThat(out).doesNotContain("\r", "\n");
    }

    @Test
    void latin1Supplement_isKept() {
        assertThat(QrTextSanitizer.sanitize("Zürich Genève Straße")).isEqualTo("Zürich Genève Straße");
    }

    @Test
    void charactersOutsideLatin1_becomeSpaces() {
        // Euro sign, Cyrillic, CJK and a tab are all outside the allowed ranges
        assertThat(QrTextSanitizer.sanitize("10€\tМосква 東京 end")).isEqualTo("10 end");
    }

    @Test
    void whitespaceRuns_collapseAndTrim() {
        assertThat(QrTextSanitizer.sanitize("   Muster    AG   ")).isEqualTo("Muster AG");
    }

    @Test
    void nullAndEmpty_giveEmptyString() {
        assertThat(QrTextSanitizer.sanitize(null)).isEmpty();
        assertThat(QrTextSanitizer.sanitize("")).isEmpty();
        assertThat(QrTextSanitizer.sanitize(" \n\r\t ")).isEmpty();
    }

    @Test
    void sanitize_isIdempotent() {
        String[] samples = {
                "Test 🎉 Company\nLine2",
                "  a  b  ",
                "\u0000\u0001ctrl\u007F\u009Fchars",
                "Rue du Marché 12\r\n1204 Genève",
                "plain"
        };
        for (String s : samples) {
            String once = QrTextSanitizer.sanitize(s);
            assertThat(QrTextSanitizer.sanitize(once)).isEqualTo(once);
        }
    }

    @Test
    void output_onlyContainsAllowedCharacters() {
        String out = QrTextSanitizer.sanitize("x\u0007y\u0099z😀w");
        assertThat(out).isEqualTo("x y z w");
        out.codePoints().forEach(cp -> assertThat(QrTextSanitizer.isAllowed(cp)).isTrue());
    }
}
