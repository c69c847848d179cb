package com.jsonparser.generator.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Typed values decoded from one parsed document, in schema order.
 *
 * STRING fields map to {@link String}, INTEGER fields to their decimal text,
 * BOOLEAN fields to {@link Boolean}.
 */
@EqualsAndHashCode
@ToString
public final class ParsedRecord {

    private final Map<String, Object> values;

    private ParsedRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ParsedRecord of(Map<String, ?> values) {
        return new ParsedRecord(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String fieldName) {
        return values.get(fieldName);
    }

    public boolean contains(String fieldName) {
        return values.containsKey(fieldName);
    }

    public int size() {
        return values.size();
    }

    public String getString(String fieldName) {
        return (String) values.get(fieldName);
    }

    public String getIntegerText(String fieldName) {
        return (String) values.get(fieldName);
    }

    /**
     * @throws NumberFormatException if the field's text is not a valid long
     */
    public Long getLong(String fieldName) {
        String text = getIntegerText(fieldName);
        return text == null ? null : Long.valueOf(text);
    }

    public Boolean getBoolean(String fieldName) {
        return (Boolean) values.get(fieldName);
    }
}
