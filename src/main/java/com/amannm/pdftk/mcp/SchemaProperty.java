package com.amannm.pdftk.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Represents a JSON schema property of a tool argument, with the element schema for array arguments.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchemaProperty(String type, String description, SchemaProperty items) {

    public static SchemaProperty string(String description) {
        return new SchemaProperty("string", description, null);
    }

    public static SchemaProperty stringArray(String description) {
        return new SchemaProperty("array", description, new SchemaProperty("string", null, null));
    }
}
