package com.querycache.service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code $name} variables in SQL text.
 *
 * Substitution is two-pass: {@code $name} tokens are first rewritten to {@code {name}} placeholders, then
 * every placeholder is replaced with its value. Text already containing {@code {name}} is therefore treated
 * as a variable reference too. Values are inserted verbatim, without quoting.
 */
public final class VariableSubstitutor {

    private static final Pattern DOLLAR_VARIABLE = Pattern.compile("\\$(\\w+)");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private VariableSubstitutor() {
    }

    /**
     * Rewrite {@code $name} tokens into {@code {name}} placeholders.
     *
     * @param sql SQL text
     * @return text with placeholders
     */
    public static String toPlaceholders(String sql) {
        return DOLLAR_VARIABLE.matcher(sql).replaceAll("{$1}");
    }

    /**
     * Replace {@code {name}} placeholders with values from {@code variables}.
     *
     * @param sql text with placeholders
     * @param variables variable values
     * @return substituted text
     * @throws MissingVariableException when a placeholder has no value
     */
    public static String fillPlaceholders(String sql, Map<String, ?> variables) {
        Matcher m = PLACEHOLDER.matcher(sql);
        StringBuilder sb = new StringBuilder(sql.length());
        while (m.find()) {
            String name = m.group(1);
            if (variables == null || !variables.containsKey(name)) {
                throw new MissingVariableException(name);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(variables.get(name))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Substitute {@code $name} variables.
     *
     * @param sql SQL text
     * @param variables variable values
     * @return substituted text
     * @throws MissingVariableException when a variable has no value
     */
    public static String substitute(String sql, Map<String, ?> variables) {
        return fillPlaceholders(toPlaceholders(sql), variables);
    }
}
