package com.jsonparser.generator.codegen.model;

/**
 * Categories of files written for a schema.
 */
public enum GeneratedFileType {
    HEADER,
    IMPLEMENTATION,
    DRIVER
}
