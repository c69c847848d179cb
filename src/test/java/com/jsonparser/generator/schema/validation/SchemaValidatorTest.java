package com.jsonparser.generator.schema.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.jsonparser.generator.schema.FieldKind;
import com.jsonparser.generator.schema.FieldSpec;
import com.jsonparser.generator.schema.RecordSchema;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaValidator.
 */
class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();

    private static RecordSchema person() {
        return RecordSchema.of("Person",
                FieldSpec.of("name", FieldKind.STRING),
                FieldSpec.of("age", FieldKind.INTEGER),
                FieldSpec.of("is_student", FieldKind.BOOLEAN));
    }

    private SchemaError errorOf(RecordSchema schema) {
        return validator.validate(schema).map(SchemaViolation::getError).orElse(null);
    }

    @Test
    void testValidSchema() {
        assertThat(validator.validate(person())).isEmpty();
        assertThat(validator.isValid(person())).isTrue();
    }

    @Test
    void testEmptyName() {
        RecordSchema schema = person().toBuilder().name("").build();

        assertThat(errorOf(schema)).isEqualTo(SchemaError.EMPTY_NAME);
    }

    @Test
    void testNullName() {
        RecordSchema schema = person().toBuilder().name(null).build();

        assertThat(errorOf(schema)).isEqualTo(SchemaError.EMPTY_NAME);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Invalid@Name", "1Person", "Per son", "Person-Record"})
    void testInvalidName(String name) {
        RecordSchema schema = person().toBuilder().name(name).build();

        SchemaViolation violation = validator.validate(schema).orElseThrow();
        assertThat(violation.getError()).isEqualTo(SchemaError.INVALID_NAME);
        assertThat(violation.getMessage()).contains(name).contains("valid C identifier");
    }

    @Test
    void testNoFields() {
        RecordSchema schema = RecordSchema.builder().name("Empty").build();

        assertThat(errorOf(schema)).isEqualTo(SchemaError.NO_FIELDS);
    }

    @Test
    void testEmptyFieldName() {
        RecordSchema schema = RecordSchema.of("Person", FieldSpec.of("", FieldKind.STRING));

        assertThat(errorOf(schema)).isEqualTo(SchemaError.EMPTY_FIELD_NAME);
    }

    @Test
    void testInvalidFieldName() {
        RecordSchema schema = RecordSchema.of("Person", FieldSpec.of("first-name", FieldKind.STRING));

        assertThat(errorOf(schema)).isEqualTo(SchemaError.INVALID_FIELD_NAME);
    }

    @Test
    void testDuplicateFieldName() {
        RecordSchema schema = RecordSchema.of("Person",
                FieldSpec.of("name", FieldKind.STRING),
                FieldSpec.of("name", FieldKind.INTEGER));

        SchemaViolation violation = validator.validate(schema).orElseThrow();
        assertThat(violation.getError()).isEqualTo(SchemaError.DUPLICATE_FIELD_NAME);
        assertThat(violation.getDetail()).isEqualTo("name");
    }

    @Test
    void testEmptyType() {
        RecordSchema schema = RecordSchema.of("Person", FieldSpec.declared("name", " "));

        SchemaViolation violation = validator.validate(schema).orElseThrow();
        assertThat(violation.getError()).isEqualTo(SchemaError.EMPTY_TYPE);
        assertThat(violation.getDetail()).isEqualTo("name");
    }

    @Test
    void testUnsupportedType() {
        RecordSchema schema = RecordSchema.of("Person", FieldSpec.declared("ratio", "float"));

        SchemaViolation violation = validator.validate(schema).orElseThrow();
        assertThat(violation.getError()).isEqualTo(SchemaError.UNSUPPORTED_TYPE);
        assertThat(violation.getMessage()).isEqualTo("unsupported type: float");
    }

    @Test
    void testNameCheckedBeforeFields() {
        RecordSchema schema = RecordSchema.of("bad name",
                FieldSpec.declared("", "float"),
                FieldSpec.declared("", "float"));

        assertThat(errorOf(schema)).isEqualTo(SchemaError.INVALID_NAME);
    }

    @Test
    void testFirstFailingFieldWins() {
        RecordSchema schema = RecordSchema.of("Person",
                FieldSpec.of("ok", FieldKind.STRING),
                FieldSpec.declared("ratio", "float"),
                FieldSpec.of("9bad", FieldKind.STRING));

        assertThat(errorOf(schema)).isEqualTo(SchemaError.UNSUPPORTED_TYPE);
    }

    @Test
    void testFieldNameCheckedBeforeType() {
        RecordSchema schema = RecordSchema.of("Person", FieldSpec.declared("bad-name", ""));

        assertThat(errorOf(schema)).isEqualTo(SchemaError.INVALID_FIELD_NAME);
    }

    @Test
    void testRequireValidThrows() {
        RecordSchema schema = RecordSchema.of("Person");

        assertThatThrownBy(() -> validator.requireValid(schema))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessage("invalid schema: schema has no fields")
                .satisfies(e -> assertThat(((SchemaValidationException) e).getError())
                        .isEqualTo(SchemaError.NO_FIELDS));
    }
}
