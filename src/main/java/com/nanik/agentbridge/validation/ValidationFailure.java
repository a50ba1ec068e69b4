package com.nanik.agentbridge.validation;

/**
 * First rule violation found while validating a tool's arguments.
 */
public class ValidationFailure {

    private final String field;
    private final String rule;
    private final String message;

    public ValidationFailure(String field, String rule, String message) {
        this.field = field;
        this.rule = rule;
        this.message = message;
    }

    public String getField() {
        return field;
    }

    public String getRule() {
        return rule;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "ValidationFailure{field='" + field + "', rule='" + rule + "', message='" + message + "'}";
    }
}
