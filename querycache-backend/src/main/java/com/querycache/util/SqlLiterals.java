package com.querycache.util;

/**
 * Helpers for embedding values into SQL text.
 */
public final class SqlLiterals {

    private SqlLiterals() {
    }

    /**
     * Quote a value as a SQL string literal, doubling embedded single quotes.
     *
     * @param value raw value
     * @return quoted literal
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
