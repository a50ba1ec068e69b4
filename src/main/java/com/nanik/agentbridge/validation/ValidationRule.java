package com.nanik.agentbridge.validation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One declarative check on a tool's arguments.
 *
 * Rules carry only data; {@link ParameterValidator} interprets them in the
 * order a tool declares them.
 */
public class ValidationRule {

    public static final int REPO_NAME_MAX_LENGTH = 200;
    public static final Pattern REPO_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+/[A-Za-z0-9_.-]+$");

    public static final long ISSUE_NUMBER_MIN = 1L;
    public static final long ISSUE_NUMBER_MAX = 999_999_999L;

    private final String field;
    private final RuleKind kind;
    private final Pattern pattern;
    private final int maxLength;
    private final long min;
    private final long max;
    private final Set<String> allowedValues;
    private final List<String> fields;

    private ValidationRule(String field, RuleKind kind, Pattern pattern, int maxLength,
                           long min, long max, Set<String> allowedValues, List<String> fields) {
        this.field = field;
        this.kind = kind;
        this.pattern = pattern;
        this.maxLength = maxLength;
        this.min = min;
        this.max = max;
        this.allowedValues = allowedValues;
        this.fields = fields;
    }

    /**
     * GitHub style {@code owner/repo} name.
     */
    public static ValidationRule repoName(String field) {
        return new ValidationRule(field, RuleKind.REPO_NAME, REPO_NAME_PATTERN, REPO_NAME_MAX_LENGTH,
            0, 0, Collections.emptySet(), Collections.emptyList());
    }

    /**
     * Integer within an inclusive range. Decimal strings are converted.
     */
    public static ValidationRule integerRange(String field, long min, long max) {
        return new ValidationRule(field, RuleKind.INTEGER, null, 0,
            min, max, Collections.emptySet(), Collections.emptyList());
    }

    /**
     * Positive issue number as accepted by the labeler agent.
     */
    public static ValidationRule issueNumber(String field) {
        return integerRange(field, ISSUE_NUMBER_MIN, ISSUE_NUMBER_MAX);
    }

    /**
     * Array whose members must all come from {@code allowed}. An empty array is
     * replaced by the tool's default for the field.
     */
    public static ValidationRule enumArray(String field, String... allowed) {
        Set<String> values = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(allowed)));
        return new ValidationRule(field, RuleKind.ENUM_ARRAY, null, 0,
            0, 0, values, Collections.emptyList());
    }

    /**
     * Free-form string with a length cap and an optional pattern.
     */
    public static ValidationRule string(String field, int maxLength, Pattern pattern) {
        return new ValidationRule(field, RuleKind.STRING, pattern, maxLength,
            0, 0, Collections.emptySet(), Collections.emptyList());
    }

    /**
     * All listed fields must be present.
     */
    public static ValidationRule required(String... fields) {
        return new ValidationRule(null, RuleKind.REQUIRED, null, 0,
            0, 0, Collections.emptySet(), List.of(fields));
    }

    /**
     * At least one of the listed fields must be present.
     */
    public static ValidationRule requireAny(String... fields) {
        return new ValidationRule(null, RuleKind.REQUIRE_ANY, null, 0,
            0, 0, Collections.emptySet(), List.of(fields));
    }

    /**
     * The single field this rule inspects, or null for presence rules.
     */
    public String getField() {
        return field;
    }

    public RuleKind getKind() {
        return kind;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public long getMin() {
        return min;
    }

    public long getMax() {
        return max;
    }

    public Set<String> getAllowedValues() {
        return allowedValues;
    }

    /**
     * Fields named by presence rules.
     */
    public List<String> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "ValidationRule{kind=" + kind + ", field=" + (field != null ? field : fields) + "}";
    }
}
