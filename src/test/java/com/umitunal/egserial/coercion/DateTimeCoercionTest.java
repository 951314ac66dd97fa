package com.umitunal.egserial.coercion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class DateTimeCoercionTest {

    private final DateTimeCoercion coercion = new DateTimeCoercion();

    @Test
    @DisplayName("Should format with the offset")
    void testFormat() {
        OffsetDateTime value = OffsetDateTime.of(2021, 3, 1, 8, 0, 0, 0, ZoneOffset.ofHours(-5));

        assertThat(coercion.format(value)).isEqualTo("2021-03-01T08:00:00-05:00");
    }

    @Test
    @DisplayName("Should parse what it formats")
    void testRoundTrip() {
        OffsetDateTime value = OffsetDateTime.of(2020, 2, 29, 23, 59, 59, 123_000_000, ZoneOffset.UTC);

        assertThat(coercion.parse(coercion.format(value))).isEqualTo(value);
    }

    @Test
    @DisplayName("Should read a missing offset as UTC")
    void testLocalDateTime() {
        assertThat(coercion.parse("2021-03-01T08:00:00"))
                .isEqualTo(OffsetDateTime.of(2021, 3, 1, 8, 0, 0, 0, ZoneOffset.UTC));
        assertThat(coercion.parse("2021-03-01 08:00"))
                .isEqualTo(OffsetDateTime.of(2021, 3, 1, 8, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should read a bare date as midnight UTC")
    void testLocalDate() {
        assertThat(coercion.parse("2021-03-01"))
                .isEqualTo(OffsetDateTime.of(2021, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should accept Z as the UTC offset")
    void testZuluOffset() {
        assertThat(coercion.parse("2021-11-02T19:30:15Z"))
                .isEqualTo(OffsetDateTime.of(2021, 11, 2, 19, 30, 15, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should reject text that is not a date")
    void testGarbage() {
        assertThatThrownBy(() -> coercion.parse("yesterday"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("yesterday");
        assertThatThrownBy(() -> coercion.parse("2021-13-01"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
