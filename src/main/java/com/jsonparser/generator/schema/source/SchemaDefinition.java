package com.jsonparser.generator.schema.source;

import java.util.ArrayList;
import java.util.List;

import com.jsonparser.generator.schema.FieldSpec;
import com.jsonparser.generator.schema.RecordSchema;

import lombok.Data;

/**
 * Result of reading a schema definition file: the declared record plus any
 * lines that could not be understood.
 */
@Data
public class SchemaDefinition {
    private String recordName;
    private final List<FieldSpec> fields = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void addField(FieldSpec field) {
        fields.add(field);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public RecordSchema toSchema() {
        return RecordSchema.builder()
                .name(recordName)
                .fields(fields)
                .build();
    }
}
