package com.jsonparser.generator.schema.validation;

/**
 * Reasons a schema is rejected before any code is generated.
 * Declaration order is the order in which the rules are checked.
 */
public enum SchemaError {
    EMPTY_NAME("empty schema name"),
    INVALID_NAME("invalid schema name"),
    NO_FIELDS("schema has no fields"),
    EMPTY_FIELD_NAME("empty field name"),
    INVALID_FIELD_NAME("invalid field name"),
    DUPLICATE_FIELD_NAME("duplicate field name"),
    EMPTY_TYPE("empty type for field"),
    UNSUPPORTED_TYPE("unsupported type");

    private final String description;

    SchemaError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
