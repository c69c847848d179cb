package com.jsonparser.generator.schema.validation;

import com.jsonparser.generator.ParserGeneratorException;

/**
 * Thrown when a schema fails validation.
 */
public class SchemaValidationException extends ParserGeneratorException {

    private static final long serialVersionUID = 1L;

    private final transient SchemaViolation violation;

    public SchemaValidationException(SchemaViolation violation) {
        super("invalid schema: " + violation.getMessage());
        this.violation = violation;
    }

    public SchemaViolation getViolation() {
        return violation;
    }

    public SchemaError getError() {
        return violation.getError();
    }
}
