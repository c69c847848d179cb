package com.jsonparser.generator.runtime.protocol;

/**
 * Layout of the record line a generated artifact writes back.
 */
public enum WireProtocol {
    /**
     * {@code SUCCESS|v1|v2|...}: values correlated to fields by declaration order.
     */
    POSITIONAL,

    /**
     * {@code SUCCESS|name1=v1|name2=v2|...}: values carry their field name.
     */
    KEYED;

    public static final String SUCCESS_SENTINEL = "SUCCESS";

    public static final String FAILURE_SENTINEL = "ERROR|Failed to parse JSON";

    public static final String DELIMITER = "|";

    public static final String KEY_SEPARATOR = "=";
}
