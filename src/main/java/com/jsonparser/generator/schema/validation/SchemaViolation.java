package com.jsonparser.generator.schema.validation;

import lombok.NonNull;
import lombok.Value;

/**
 * The first rule a schema broke, with the offending name or type.
 */
@Value
public class SchemaViolation {

    @NonNull
    SchemaError error;

    String detail;

    public static SchemaViolation of(SchemaError error) {
        return new SchemaViolation(error, null);
    }

    public static SchemaViolation of(SchemaError error, String detail) {
        return new SchemaViolation(error, detail);
    }

    public String getMessage() {
        return detail == null ? error.getDescription() : error.getDescription() + ": " + detail;
    }
}
