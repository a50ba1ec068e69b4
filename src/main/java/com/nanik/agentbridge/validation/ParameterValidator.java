package com.nanik.agentbridge.validation;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.nanik.agentbridge.protocol.JsonDepth;
import com.nanik.agentbridge.tools.ToolDescriptor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates and sanitizes a tool's argument mapping.
 *
 * Validation runs in four steps:
 * 1. the arguments must nest no deeper than {@link #MAX_NESTING_DEPTH} and
 *    their serialized form must fit within the payload limit;
 * 2. the tool's declared rules run in order, the first failure wins;
 * 3. remaining fields are checked by their canonical rule when one exists
 *    ({@code repo_name}, {@code issue_number}, {@code sources}), otherwise
 *    every string they contain is length checked and stripped of shell
 *    metacharacters, object keys included;
 * 4. the tool's defaults fill in absent fields.
 *
 * The validator holds no mutable state and never touches the input object.
 */
public class ParameterValidator {

    public static final int DEFAULT_MAX_STRING_LENGTH = 10_000;
    public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 10_000;
    public static final int MAX_NESTING_DEPTH = 32;

    public static final String[] ALLOWED_SOURCES = {"github", "pypi", "npm", "reddit", "hackernews"};

    private static final Pattern SHELL_METACHARACTERS = Pattern.compile("[;|&$`<>()\\r\\n]");

    private static final Map<String, ValidationRule> CANONICAL_RULES = new LinkedHashMap<>();

    static {
        CANONICAL_RULES.put("repo_name", ValidationRule.repoName("repo_name"));
        CANONICAL_RULES.put("issue_number", ValidationRule.issueNumber("issue_number"));
        CANONICAL_RULES.put("sources", ValidationRule.enumArray("sources", ALLOWED_SOURCES));
    }

    private final int maxStringLength;
    private final int maxPayloadLength;

    public ParameterValidator() {
        this(DEFAULT_MAX_STRING_LENGTH, DEFAULT_MAX_PAYLOAD_LENGTH);
    }

    public ParameterValidator(int maxStringLength, int maxPayloadLength) {
        if (maxStringLength <= 0 || maxPayloadLength <= 0) {
            throw new IllegalArgumentException("validation limits must be positive");
        }
        this.maxStringLength = maxStringLength;
        this.maxPayloadLength = maxPayloadLength;
    }

    /**
     * Validate arguments against a tool's rules and defaults.
     */
    public ValidationOutcome validate(ToolDescriptor tool, JsonObject rawArguments) {
        return validate(tool.getRules(), tool.getAgentConfig().getDefaults(), rawArguments);
    }

    /**
     * Validate arguments against an explicit rule list.
     *
     * @param rules rules in evaluation order
     * @param defaults default values merged in for absent fields, may be null
     * @param rawArguments caller supplied arguments, may be null
     */
    public ValidationOutcome validate(List<ValidationRule> rules, JsonObject defaults, JsonObject rawArguments) {
        if (JsonDepth.exceeds(rawArguments, MAX_NESTING_DEPTH)) {
            return ValidationOutcome.invalid("arguments", RuleKind.MAX_DEPTH,
                "params nest deeper than " + MAX_NESTING_DEPTH + " levels");
        }
        JsonObject arguments = rawArguments != null ? rawArguments.deepCopy() : new JsonObject();
        JsonObject defaultValues = defaults != null ? defaults : new JsonObject();

        int payloadLength = arguments.toString().length();
        if (payloadLength > maxPayloadLength) {
            return ValidationOutcome.invalid("arguments", RuleKind.MAX_PAYLOAD,
                "params payload is too large (" + payloadLength + " > " + maxPayloadLength + " characters)");
        }

        Set<String> checked = new HashSet<>();
        for (ValidationRule rule : rules) {
            ValidationFailure failure = apply(rule, arguments, defaultValues);
            if (failure != null) {
                return ValidationOutcome.invalid(failure);
            }
            if (rule.getField() != null) {
                checked.add(rule.getField());
            }
        }

        for (String field : new ArrayList<>(arguments.keySet())) {
            if (checked.contains(field)) {
                continue;
            }
            ValidationRule canonical = CANONICAL_RULES.get(field);
            ValidationFailure failure = canonical != null
                ? apply(canonical, arguments, defaultValues)
                : checkStrings(field, arguments.get(field));
            if (failure != null) {
                return ValidationOutcome.invalid(failure);
            }
            if (canonical == null) {
                arguments.add(field, sanitize(arguments.get(field)));
            }
        }

        arguments = sanitizeKeys(arguments);
        for (Map.Entry<String, JsonElement> entry : defaultValues.entrySet()) {
            if (!arguments.has(entry.getKey())) {
                arguments.add(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        return ValidationOutcome.valid(arguments);
    }

    /**
     * Remove shell metacharacters from a string.
     */
    public static String sanitize(String value) {
        return SHELL_METACHARACTERS.matcher(value).replaceAll("");
    }

    public int getMaxStringLength() {
        return maxStringLength;
    }

    public int getMaxPayloadLength() {
        return maxPayloadLength;
    }

    /**
     * Apply one rule, converting or replacing the field value in place.
     * @return null if the rule holds, the failure otherwise
     */
    private ValidationFailure apply(ValidationRule rule, JsonObject arguments, JsonObject defaults) {
        switch (rule.getKind()) {
            case REQUIRED:
                return checkRequired(rule, arguments);
            case REQUIRE_ANY:
                return checkRequireAny(rule, arguments);
            default:
                break;
        }

        String field = rule.getField();
        JsonElement value = arguments.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }

        switch (rule.getKind()) {
            case REPO_NAME:
                return checkRepoName(rule, value);
            case INTEGER:
                return checkInteger(rule, arguments, value);
            case ENUM_ARRAY:
                return checkEnumArray(rule, arguments, value, defaults);
            case STRING:
                return checkString(rule, arguments, value);
            default:
                throw new IllegalStateException("Unhandled rule kind: " + rule.getKind());
        }
    }

    private ValidationFailure checkRequired(ValidationRule rule, JsonObject arguments) {
        List<String> missing = rule.getFields().stream()
            .filter(name -> isAbsent(arguments, name))
            .collect(Collectors.toList());
        if (missing.isEmpty()) {
            return null;
        }
        return failure(String.join(",", missing), rule, "Missing required parameters: " + missing);
    }

    private ValidationFailure checkRequireAny(ValidationRule rule, JsonObject arguments) {
        for (String name : rule.getFields()) {
            if (!isAbsent(arguments, name)) {
                return null;
            }
        }
        String options = rule.getFields().stream()
            .map(name -> "'" + name + "'")
            .collect(Collectors.joining(" or "));
        return failure(String.join("|", rule.getFields()), rule, "Missing " + options + " parameter");
    }

    private ValidationFailure checkRepoName(ValidationRule rule, JsonElement value) {
        String field = rule.getField();
        if (!isString(value)) {
            return failure(field, rule, field + " must be a string, got " + typeName(value));
        }
        String repo = value.getAsString();
        if (repo.length() > rule.getMaxLength()) {
            return failure(field, rule, field + " is too long (max " + rule.getMaxLength() + " characters)");
        }
        if (!rule.getPattern().matcher(repo).matches()) {
            return failure(field, rule, "Invalid " + field + " format: '" + repo + "'. Expected format: 'owner/repo'");
        }
        return null;
    }

    private ValidationFailure checkInteger(ValidationRule rule, JsonObject arguments, JsonElement value) {
        String field = rule.getField();
        BigDecimal number;
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            number = value.getAsBigDecimal();
        } else if (isString(value)) {
            try {
                number = new BigDecimal(value.getAsString().trim());
            } catch (NumberFormatException e) {
                return failure(field, rule, "Invalid " + field + ": '" + value.getAsString() + "' is not a number");
            }
        } else {
            return failure(field, rule, field + " must be an integer, got " + typeName(value));
        }

        if (number.signum() != 0 && number.stripTrailingZeros().scale() > 0) {
            return failure(field, rule, "Invalid " + field + ": " + number.toPlainString() + " is not an integer");
        }
        if (number.compareTo(BigDecimal.valueOf(rule.getMin())) < 0) {
            return failure(field, rule, field + " must be at least " + rule.getMin());
        }
        if (number.compareTo(BigDecimal.valueOf(rule.getMax())) > 0) {
            return failure(field, rule, field + " is too large (max " + rule.getMax() + ")");
        }
        arguments.addProperty(field, number.longValueExact());
        return null;
    }

    private ValidationFailure checkEnumArray(ValidationRule rule, JsonObject arguments, JsonElement value,
                                             JsonObject defaults) {
        String field = rule.getField();
        if (!value.isJsonArray()) {
            return failure(field, rule, field + " must be a list, got " + typeName(value));
        }
        JsonArray array = value.getAsJsonArray();
        for (JsonElement member : array) {
            if (!isString(member)) {
                return failure(field, rule, field + " members must be strings, got " + typeName(member));
            }
            if (!rule.getAllowedValues().contains(member.getAsString())) {
                return failure(field, rule, "Invalid value '" + member.getAsString() + "' in " + field
                    + ". Allowed: " + rule.getAllowedValues());
            }
        }
        if (array.size() == 0 && defaults.has(field)) {
            arguments.add(field, defaults.get(field).deepCopy());
        }
        return null;
    }

    private ValidationFailure checkString(ValidationRule rule, JsonObject arguments, JsonElement value) {
        String field = rule.getField();
        if (!isString(value)) {
            return failure(field, rule, field + " must be a string, got " + typeName(value));
        }
        String text = value.getAsString();
        int limit = rule.getMaxLength() > 0 ? Math.min(rule.getMaxLength(), maxStringLength) : maxStringLength;
        if (text.length() > limit) {
            return failure(field, rule, field + " is too long (max " + limit + " characters)");
        }
        if (rule.getPattern() != null && !rule.getPattern().matcher(text).matches()) {
            return failure(field, rule, field + " does not match " + rule.getPattern().pattern());
        }
        arguments.addProperty(field, sanitize(text));
        return null;
    }

    /**
     * Length check every string reachable from {@code value}.
     */
    private ValidationFailure checkStrings(String field, JsonElement value) {
        if (isString(value)) {
            if (value.getAsString().length() > maxStringLength) {
                return new ValidationFailure(field, RuleKind.STRING.getWireName(),
                    field + " is too long (max " + maxStringLength + " characters)");
            }
        } else if (value.isJsonArray()) {
            for (JsonElement member : value.getAsJsonArray()) {
                ValidationFailure failure = checkStrings(field, member);
                if (failure != null) {
                    return failure;
                }
            }
        } else if (value.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
                ValidationFailure failure = checkStrings(field + "." + entry.getKey(), entry.getValue());
                if (failure != null) {
                    return failure;
                }
            }
        }
        return null;
    }

    private static JsonElement sanitize(JsonElement value) {
        if (isString(value)) {
            return new JsonPrimitive(sanitize(value.getAsString()));
        }
        if (value.isJsonArray()) {
            JsonArray copy = new JsonArray();
            for (JsonElement member : value.getAsJsonArray()) {
                copy.add(sanitize(member));
            }
            return copy;
        }
        if (value.isJsonObject()) {
            JsonObject copy = new JsonObject();
            for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
                String key = sanitize(entry.getKey());
                if (!copy.has(key)) {
                    copy.add(key, sanitize(entry.getValue()));
                }
            }
            return copy;
        }
        return value;
    }

    /**
     * Strip metacharacters from top-level keys. When two keys collapse onto
     * the same name the first one is kept.
     */
    private static JsonObject sanitizeKeys(JsonObject arguments) {
        JsonObject copy = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : arguments.entrySet()) {
            String key = sanitize(entry.getKey());
            if (!copy.has(key)) {
                copy.add(key, entry.getValue());
            }
        }
        return copy;
    }

    private static ValidationFailure failure(String field, ValidationRule rule, String message) {
        return new ValidationFailure(field, rule.getKind().getWireName(), message);
    }

    private static boolean isAbsent(JsonObject arguments, String name) {
        return !arguments.has(name) || arguments.get(name).isJsonNull();
    }

    private static boolean isString(JsonElement value) {
        return value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
    }

    private static String typeName(JsonElement value) {
        if (value.isJsonNull()) {
            return "null";
        }
        if (value.isJsonArray()) {
            return "array";
        }
        if (value.isJsonObject()) {
            return "object";
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return "boolean";
        }
        return primitive.isNumber() ? "number" : "string";
    }
}
