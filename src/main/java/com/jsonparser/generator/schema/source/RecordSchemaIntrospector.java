package com.jsonparser.generator.schema.source;

import java.lang.reflect.RecordComponent;
import java.util.Map;

import com.jsonparser.generator.schema.FieldKind;
import com.jsonparser.generator.schema.FieldSpec;
import com.jsonparser.generator.schema.RecordSchema;
import com.jsonparser.generator.schema.WireName;

/**
 * Derives a {@link RecordSchema} from a Java record declaration.
 *
 * Component types outside the supported kinds are carried through by their
 * simple name, so validation reports them as unsupported instead of this
 * class failing early.
 */
public class RecordSchemaIntrospector {

    private static final Map<Class<?>, FieldKind> KIND_BY_TYPE = Map.ofEntries(
            Map.entry(String.class, FieldKind.STRING),
            Map.entry(CharSequence.class, FieldKind.STRING),
            Map.entry(int.class, FieldKind.INTEGER),
            Map.entry(Integer.class, FieldKind.INTEGER),
            Map.entry(long.class, FieldKind.INTEGER),
            Map.entry(Long.class, FieldKind.INTEGER),
            Map.entry(short.class, FieldKind.INTEGER),
            Map.entry(Short.class, FieldKind.INTEGER),
            Map.entry(byte.class, FieldKind.INTEGER),
            Map.entry(Byte.class, FieldKind.INTEGER),
            Map.entry(boolean.class, FieldKind.BOOLEAN),
            Map.entry(Boolean.class, FieldKind.BOOLEAN)
    );

    public RecordSchema introspect(Class<?> type) {
        if (!type.isRecord()) {
            throw new IllegalArgumentException("Not a record type: " + type.getName());
        }

        RecordSchema.RecordSchemaBuilder builder = RecordSchema.builder().name(type.getSimpleName());
        for (RecordComponent component : type.getRecordComponents()) {
            builder.field(FieldSpec.declared(fieldName(component), declaredType(component.getType())));
        }
        return builder.build();
    }

    private static String fieldName(RecordComponent component) {
        WireName wireName = component.getAnnotation(WireName.class);
        return wireName != null ? wireName.value() : component.getName();
    }

    private static String declaredType(Class<?> type) {
        FieldKind kind = KIND_BY_TYPE.get(type);
        return kind != null ? kind.getCanonicalName() : type.getSimpleName();
    }
}
