package com.jsonparser.generator.schema;

import java.util.Arrays;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A named, flat record shape: an ordered list of typed fields.
 *
 * Pure structure only. Use {@code SchemaValidator} before handing a schema
 * to the code generator.
 */
@Value
@Builder(toBuilder = true)
public class RecordSchema {

    String name;

    @Singular
    List<FieldSpec> fields;

    public static RecordSchema of(String name, FieldSpec... fields) {
        return RecordSchema.builder()
                .name(name)
                .fields(Arrays.asList(fields))
                .build();
    }

    public int getFieldCount() {
        return fields.size();
    }
}
