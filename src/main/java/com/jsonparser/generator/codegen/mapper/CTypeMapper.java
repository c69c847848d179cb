package com.jsonparser.generator.codegen.mapper;

import java.util.Optional;

import com.jsonparser.generator.schema.FieldKind;

import lombok.experimental.UtilityClass;

@UtilityClass
public class CTypeMapper {

    /**
     * Get the C member type used for a field of the given kind.
     */
    public String toCType(FieldKind kind) {
        return switch (kind) {
            case STRING -> "char*";
            case INTEGER -> "int64_t";
            case BOOLEAN -> "bool";
        };
    }

    /**
     * Look up the C type for a raw declared type; empty when the type is not supported.
     */
    public Optional<String> lookup(String declaredType) {
        return FieldKind.fromDeclaredType(declaredType).map(CTypeMapper::toCType);
    }

    public boolean hasMapping(String declaredType) {
        return lookup(declaredType).isPresent();
    }
}
