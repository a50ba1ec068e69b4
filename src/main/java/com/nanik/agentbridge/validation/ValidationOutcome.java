package com.nanik.agentbridge.validation;

import com.google.gson.JsonObject;

/**
 * Result of validating an argument mapping: either the sanitized arguments
 * or the failure that stopped validation.
 */
public class ValidationOutcome {

    private final JsonObject arguments;
    private final ValidationFailure failure;

    private ValidationOutcome(JsonObject arguments, ValidationFailure failure) {
        this.arguments = arguments;
        this.failure = failure;
    }

    public static ValidationOutcome valid(JsonObject arguments) {
        return new ValidationOutcome(arguments, null);
    }

    public static ValidationOutcome invalid(String field, RuleKind rule, String message) {
        return invalid(new ValidationFailure(field, rule.getWireName(), message));
    }

    public static ValidationOutcome invalid(ValidationFailure failure) {
        return new ValidationOutcome(null, failure);
    }

    public boolean isValid() {
        return failure == null;
    }

    /**
     * Sanitized arguments with tool defaults applied; null when invalid.
     */
    public JsonObject getArguments() {
        return arguments;
    }

    public ValidationFailure getFailure() {
        return failure;
    }
}
