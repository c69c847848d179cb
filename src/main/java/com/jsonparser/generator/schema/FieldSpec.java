package com.jsonparser.generator.schema;

import java.util.Optional;

import lombok.Value;

/**
 * One field of a record schema.
 *
 * The name is both the generated struct member and the JSON key the parser
 * looks for. The declared type is kept as written by the source of truth so
 * validation can tell a missing type from an unsupported one.
 */
@Value
public class FieldSpec {

    String name;

    String declaredType;

    public static FieldSpec of(String name, FieldKind kind) {
        return new FieldSpec(name, kind.getCanonicalName());
    }

    public static FieldSpec declared(String name, String declaredType) {
        return new FieldSpec(name, declaredType);
    }

    public Optional<FieldKind> getKind() {
        return FieldKind.fromDeclaredType(declaredType);
    }

    /**
     * Kind of a field that already passed validation.
     *
     * @throws IllegalStateException if the declared type is not supported
     */
    public FieldKind requireKind() {
        return getKind().orElseThrow(() -> new IllegalStateException(
                "Field '" + name + "' has unsupported type: " + declaredType));
    }
}
