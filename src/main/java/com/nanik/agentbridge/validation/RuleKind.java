package com.nanik.agentbridge.validation;

/**
 * Kinds of checks a {@link ValidationRule} can perform.
 */
public enum RuleKind {
    STRING("string"),
    INTEGER("integer_range"),
    ENUM_ARRAY("enum_array"),
    REPO_NAME("repo_name"),
    REQUIRED("required"),
    REQUIRE_ANY("require_any"),
    MAX_PAYLOAD("max_payload"),
    MAX_DEPTH("max_depth");

    private final String wireName;

    RuleKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name reported back to callers in validation failures.
     */
    public String getWireName() {
        return wireName;
    }
}
