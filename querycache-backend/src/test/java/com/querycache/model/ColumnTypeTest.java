package com.querycache.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnTypeTest {

    @Test
    void infersUniformColumns() {
        assertThat(ColumnType.infer(List.of(1, 2L, 3))).isEqualTo(ColumnType.INTEGER);
        assertThat(ColumnType.infer(List.of(1.5, new BigDecimal("2.25")))).isEqualTo(ColumnType.FLOAT);
        assertThat(ColumnType.infer(List.of(true, false))).isEqualTo(ColumnType.BOOLEAN);
        assertThat(ColumnType.infer(List.of(LocalDateTime.now(), Instant.now()))).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(ColumnType.infer(List.of(LocalDate.now()))).isEqualTo(ColumnType.DATE);
        assertThat(ColumnType.infer(List.of("a"))).isEqualTo(ColumnType.STRING);
    }

    @Test
    void mixedIntegersAndFloatsWidenToFloat() {
        assertThat(ColumnType.infer(List.of(1, 2.5))).isEqualTo(ColumnType.FLOAT);
    }

    @Test
    void otherMixesFallBackToString() {
        assertThat(ColumnType.infer(List.of(1, "x"))).isEqualTo(ColumnType.STRING);
        assertThat(ColumnType.infer(List.of(true, 1))).isEqualTo(ColumnType.STRING);
    }

    @Test
    void nullsAreIgnoredAndAllNullIsString() {
        assertThat(ColumnType.infer(Arrays.asList(null, 4, null))).isEqualTo(ColumnType.INTEGER);
        assertThat(ColumnType.infer(Arrays.asList(null, null))).isEqualTo(ColumnType.STRING);
    }

    @Test
    void bigIntegersInLongRangeAreIntegers() {
        assertThat(ColumnType.ofValue(BigInteger.valueOf(Long.MAX_VALUE))).isEqualTo(ColumnType.INTEGER);
        assertThat(ColumnType.INTEGER.normalize(BigInteger.valueOf(Long.MIN_VALUE))).isEqualTo(Long.MIN_VALUE);
        assertThat(ColumnType.ofValue(BigInteger.ONE.shiftLeft(63))).isEqualTo(ColumnType.STRING);
        assertThat(ColumnType.STRING.normalize(new BigDecimal("1E+20"))).isEqualTo("100000000000000000000");
    }

    @Test
    void sqlTimestampKeepsWallClockWhileOtherDatesConvertToUtc() {
        Instant instant = Instant.parse("2024-01-02T03:04:05Z");

        assertThat(ColumnType.TIMESTAMP.normalize(Date.from(instant))).isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        assertThat(ColumnType.TIMESTAMP.normalize(OffsetDateTime.of(2024, 1, 2, 5, 4, 5, 0, ZoneOffset.ofHours(2))))
                .isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        assertThat(ColumnType.TIMESTAMP.normalize(Timestamp.valueOf(LocalDateTime.of(2024, 1, 2, 3, 4, 5))))
                .isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
    }

    @Test
    void normalizesToCanonicalValues() {
        assertThat(ColumnType.INTEGER.normalize(5)).isEqualTo(5L);
        assertThat(ColumnType.INTEGER.normalize(" 12 ")).isEqualTo(12L);
        assertThat(ColumnType.FLOAT.normalize(3)).isEqualTo(3.0);
        assertThat(ColumnType.TIMESTAMP.normalize(Timestamp.valueOf("2024-01-02 03:04:05")))
                .isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        assertThat(ColumnType.TIMESTAMP.normalize(Instant.parse("2024-01-02T03:04:05Z")))
                .isEqualTo(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        assertThat(ColumnType.DATE.normalize(java.sql.Date.valueOf("2024-01-02"))).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(ColumnType.STRING.normalize(42)).isEqualTo("42");
        assertThat(ColumnType.BOOLEAN.normalize(null)).isNull();
    }
}
