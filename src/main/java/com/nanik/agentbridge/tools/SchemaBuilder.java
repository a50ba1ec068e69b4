package com.nanik.agentbridge.tools;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Helper class for building JSON Schema objects for tool input definitions.
 */
public class SchemaBuilder {

    private final JsonObject schema;
    private final JsonObject properties;
    private final JsonArray required;

    public SchemaBuilder() {
        this.schema = new JsonObject();
        this.properties = new JsonObject();
        this.required = new JsonArray();

        schema.addProperty("type", "object");
        schema.add("properties", properties);
    }

    /**
     * Schema accepting any object, used for agents without a declared shape.
     */
    public static JsonObject openObject() {
        JsonObject schema = new SchemaBuilder().build();
        schema.addProperty("additionalProperties", true);
        return schema;
    }

    /**
     * Add a string property.
     */
    public SchemaBuilder addString(String name, String description, boolean isRequired) {
        properties.add(name, property("string", description));
        markRequired(name, isRequired);
        return this;
    }

    /**
     * Add a string property constrained by a pattern and a maximum length.
     */
    public SchemaBuilder addPatternString(String name, String description, boolean isRequired,
                                          String pattern, int maxLength) {
        JsonObject prop = property("string", description);
        prop.addProperty("pattern", pattern);
        prop.addProperty("maxLength", maxLength);
        properties.add(name, prop);
        markRequired(name, isRequired);
        return this;
    }

    /**
     * Add an integer property with an inclusive range.
     */
    public SchemaBuilder addInteger(String name, String description, boolean isRequired, long minimum, long maximum) {
        JsonObject prop = property("integer", description);
        prop.addProperty("minimum", minimum);
        prop.addProperty("maximum", maximum);
        properties.add(name, prop);
        markRequired(name, isRequired);
        return this;
    }

    /**
     * Add a boolean property with default value.
     */
    public SchemaBuilder addBoolean(String name, String description, boolean defaultValue) {
        JsonObject prop = property("boolean", description);
        prop.addProperty("default", defaultValue);
        properties.add(name, prop);
        return this;
    }

    /**
     * Add an array property whose items come from a fixed set.
     *
     * @param defaultValue default array advertised to callers, may be null
     */
    public SchemaBuilder addEnumArray(String name, String description, JsonElement defaultValue, String... allowed) {
        JsonObject items = new JsonObject();
        items.addProperty("type", "string");
        JsonArray values = new JsonArray();
        for (String value : allowed) {
            values.add(value);
        }
        items.add("enum", values);

        JsonObject prop = property("array", description);
        prop.add("items", items);
        if (defaultValue != null) {
            prop.add("default", defaultValue.deepCopy());
        }
        properties.add(name, prop);
        return this;
    }

    /**
     * Build the final schema.
     */
    public JsonObject build() {
        if (required.size() > 0) {
            schema.add("required", required);
        }
        return schema;
    }

    private static JsonObject property(String type, String description) {
        JsonObject prop = new JsonObject();
        prop.addProperty("type", type);
        prop.addProperty("description", description);
        return prop;
    }

    private void markRequired(String name, boolean isRequired) {
        if (isRequired) {
            required.add(name);
        }
    }
}
