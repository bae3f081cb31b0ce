package com.querycache.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script into statements on {@code ;}.
 *
 * The split is purely textual: a semicolon inside a string literal or comment also ends a statement.
 */
public final class SqlScriptSplitter {

    private SqlScriptSplitter() {
    }

    /**
     * Split a script into trimmed, non-blank statements.
     *
     * @param script SQL script
     * @return statements in script order
     */
    public static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null) {
            return statements;
        }
        for (String part : script.strip().split(";")) {
            String statement = part.strip();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }
}
