package com.jsonparser.generator.schema.validation;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.jsonparser.generator.schema.FieldSpec;
import com.jsonparser.generator.schema.RecordSchema;

/**
 * Checks that a schema can be turned into C code.
 *
 * Rules are evaluated in a fixed order and the first failure is reported, so
 * a schema breaking several rules always yields the same error.
 */
public class SchemaValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public Optional<SchemaViolation> validate(RecordSchema schema) {
        String name = schema.getName();
        if (name == null || name.isEmpty()) {
            return Optional.of(SchemaViolation.of(SchemaError.EMPTY_NAME));
        }
        if (!isIdentifier(name)) {
            return Optional.of(SchemaViolation.of(SchemaError.INVALID_NAME,
                    name + " (must be a valid C identifier)"));
        }

        List<FieldSpec> fields = schema.getFields();
        if (fields == null || fields.isEmpty()) {
            return Optional.of(SchemaViolation.of(SchemaError.NO_FIELDS));
        }

        Set<String> seen = new HashSet<>();
        for (FieldSpec field : fields) {
            Optional<SchemaViolation> violation = validateField(field, seen);
            if (violation.isPresent()) {
                return violation;
            }
        }
        return Optional.empty();
    }

    /**
     * @throws SchemaValidationException carrying the first violated rule
     */
    public void requireValid(RecordSchema schema) throws SchemaValidationException {
        Optional<SchemaViolation> violation = validate(schema);
        if (violation.isPresent()) {
            throw new SchemaValidationException(violation.get());
        }
    }

    public boolean isValid(RecordSchema schema) {
        return validate(schema).isEmpty();
    }

    private Optional<SchemaViolation> validateField(FieldSpec field, Set<String> seen) {
        String fieldName = field.getName();
        if (fieldName == null || fieldName.isEmpty()) {
            return Optional.of(SchemaViolation.of(SchemaError.EMPTY_FIELD_NAME));
        }
        if (!isIdentifier(fieldName)) {
            return Optional.of(SchemaViolation.of(SchemaError.INVALID_FIELD_NAME,
                    fieldName + " (must be a valid C identifier)"));
        }
        if (!seen.add(fieldName)) {
            return Optional.of(SchemaViolation.of(SchemaError.DUPLICATE_FIELD_NAME, fieldName));
        }

        String declaredType = field.getDeclaredType();
        if (declaredType == null || declaredType.isBlank()) {
            return Optional.of(SchemaViolation.of(SchemaError.EMPTY_TYPE, fieldName));
        }
        if (field.getKind().isEmpty()) {
            return Optional.of(SchemaViolation.of(SchemaError.UNSUPPORTED_TYPE, declaredType));
        }
        return Optional.empty();
    }

    private static boolean isIdentifier(String value) {
        return IDENTIFIER.matcher(value).matches();
    }
}
