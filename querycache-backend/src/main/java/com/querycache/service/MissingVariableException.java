package com.querycache.service;

/**
 * Thrown when query text references a variable that the caller did not supply.
 */
public class MissingVariableException extends IllegalArgumentException {
    private final String variable;

    /**
     * Create a new exception.
     *
     * @param variable name of the missing variable, without the {@code $} prefix
     */
    public MissingVariableException(String variable) {
        super("Missing value for query variable: " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
