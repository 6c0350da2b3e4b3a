package com.infinitspace.nexudus.transform;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static com.infinitspace.nexudus.support.Payloads.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadValuesTest {

    @Test
    void str_TrimsAndTurnsBlankIntoNull() {
        assertThat(PayloadValues.str(json("\"  Belfast  \""))).isEqualTo("Belfast");
        assertThat(PayloadValues.str(json("\"   \""))).isNull();
        assertThat(PayloadValues.str(json("null"))).isNull();
        assertThat(PayloadValues.str(null)).isNull();
        assertThat(PayloadValues.str(json("42"))).isEqualTo("42");
    }

    @Test
    void bit_FollowsJsonTruthiness() {
        assertThat(PayloadValues.bit(json("true"))).isEqualTo(1);
        assertThat(PayloadValues.bit(json("false"))).isEqualTo(0);
        assertThat(PayloadValues.bit(json("0"))).isEqualTo(0);
        assertThat(PayloadValues.bit(json("2"))).isEqualTo(1);
        assertThat(PayloadValues.bit(json("\"\""))).isEqualTo(0);
        assertThat(PayloadValues.bit(json("null"))).isNull();
        assertThat(PayloadValues.bitOrZero(json("null"))).isZero();
    }

    @Test
    void toInt_CoercesLooseValues() {
        assertThat(PayloadValues.toInt(json("7"))).isEqualTo(7);
        assertThat(PayloadValues.toInt(json("7.9"))).isEqualTo(7);
        assertThat(PayloadValues.toInt(json("\" 12 \""))).isEqualTo(12);
        assertThat(PayloadValues.toInt(json("\"twelve\""))).isNull();
        assertThat(PayloadValues.toInt(json("true"))).isEqualTo(1);
        assertThat(PayloadValues.toInt(json("{}"))).isNull();
    }

    @Test
    void decimal_KeepsPrecision() {
        assertThat(PayloadValues.decimal(json("125.50"))).isEqualByComparingTo(new BigDecimal("125.50"));
        assertThat(PayloadValues.decimal(json("\"99.9\""))).isEqualByComparingTo(new BigDecimal("99.9"));
        assertThat(PayloadValues.decimal(json("\"n/a\""))).isNull();
    }

    @Test
    void dateTime_NormalisesOffsetsToUtc() {
        assertThat(PayloadValues.dateTime(json("\"2024-03-01T09:30:00Z\"")))
                .isEqualTo(LocalDateTime.of(2024, 3, 1, 9, 30));
        assertThat(PayloadValues.dateTime(json("\"2024-03-01T09:30:00+01:00\"")))
                .isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 30));
    }

    @Test
    void dateTime_AcceptsLocalFormsAndRejectsGarbage() {
        assertThat(PayloadValues.dateTime(json("\"2024-03-01T09:30:00.123\"")))
                .isEqualTo(LocalDateTime.of(2024, 3, 1, 9, 30, 0, 123_000_000));
        assertThat(PayloadValues.dateTime(json("\"2024-03-01\"")))
                .isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(PayloadValues.dateTime(json("\"yesterday\""))).isNull();
        assertThat(PayloadValues.dateTime(json("null"))).isNull();
    }

    @Test
    void stripHtml_RemovesTagsAndCollapsesWhitespace() {
        assertThat(PayloadValues.stripHtml(json("\"<p>Flexible   <b>office</b></p>\\n<br/>space\"")))
                .isEqualTo("Flexible office space");
        assertThat(PayloadValues.stripHtml(json("\"<p></p>\""))).isNull();
    }

    @Test
    void requireLong_MissingField_Throws() {
        assertThat(PayloadValues.requireLong(json("{\"Id\": 5}"), "Id")).isEqualTo(5L);
        assertThatThrownBy(() -> PayloadValues.requireLong(json("{\"Name\": \"x\"}"), "Id"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Id");
    }
}
