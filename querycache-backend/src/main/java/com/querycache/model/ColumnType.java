package com.querycache.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;

/**
 * Logical column types carried by a {@link TabularResult}.
 */
public enum ColumnType {
    INTEGER,
    FLOAT,
    BOOLEAN,
    TIMESTAMP,
    DATE,
    STRING,
    BINARY;

    /**
     * Infer the column type of a set of Java values.
     *
     * A column is only given a non-string type when every non-null value agrees on it;
     * mixed or unrecognized values fall back to {@link #STRING}. An all-null column is a string column.
     *
     * @param values column values
     * @return inferred type
     */
    public static ColumnType infer(Collection<?> values) {
        ColumnType inferred = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            ColumnType current = ofValue(value);
            if (inferred == null) {
                inferred = current;
            } else if (inferred != current) {
                if (isNumeric(inferred) && isNumeric(current)) {
                    inferred = FLOAT;
                } else {
                    return STRING;
                }
            }
        }
        return inferred != null ? inferred : STRING;
    }

    /**
     * Map a single Java value to a column type.
     *
     * @param value non-null value
     * @return column type
     */
    public static ColumnType ofValue(Object value) {
        if (value instanceof java.sql.Time) {
            return STRING;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return INTEGER;
        }
        if (value instanceof BigInteger big) {
            // Wider than 64 bits: kept exact as text.
            return big.bitLength() < Long.SIZE ? INTEGER : STRING;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return FLOAT;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof LocalDate || value instanceof java.sql.Date) {
            return DATE;
        }
        if (value instanceof LocalDateTime || value instanceof Instant || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime || value instanceof Date) {
            return TIMESTAMP;
        }
        if (value instanceof byte[]) {
            return BINARY;
        }
        return STRING;
    }

    /**
     * Convert a value to the canonical Java representation of this type.
     *
     * Canonical forms are {@code Long}, {@code Double}, {@code Boolean}, {@code LocalDateTime},
     * {@code LocalDate}, {@code String} and {@code byte[]}.
     *
     * <p>Timestamps follow one rule: a {@link java.sql.Timestamp} is a wall-clock value, as JDBC reads and
     * binds {@code TIMESTAMP_NTZ}, and keeps its local fields. Every other instant-like value
     * ({@link Instant}, offset or zoned date-times, {@link Date}) is converted to UTC.
     *
     * <p>Integer values must fit 64 bits; {@code BigInteger} and {@code BigDecimal} are converted exactly.
     *
     * @param value value, may be null
     * @return canonical value or null
     * @throws IllegalArgumentException when the value cannot be represented in this type
     */
    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case INTEGER:
                return toLong(value);
            case FLOAT:
                return value instanceof Number n ? n.doubleValue() : Double.parseDouble(value.toString().trim());
            case BOOLEAN:
                return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString().trim());
            case TIMESTAMP:
                return toLocalDateTime(value);
            case DATE:
                if (value instanceof java.sql.Date d) {
                    return d.toLocalDate();
                }
                return value instanceof LocalDate d ? d : LocalDate.parse(value.toString().trim());
            case BINARY:
                return value instanceof byte[] bytes ? bytes : value.toString().getBytes(StandardCharsets.UTF_8);
            default:
                return value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
        }
    }

    private static Long toLong(Object value) {
        try {
            if (value instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.longValueExact();
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Value " + value + " does not fit a 64-bit integer column", e);
        }
        return value instanceof Number n ? n.longValue() : Long.parseLong(value.toString().trim());
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (value instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        return LocalDateTime.parse(value.toString().trim());
    }

    private static boolean isNumeric(ColumnType type) {
        return type == INTEGER || type == FLOAT;
    }
}
