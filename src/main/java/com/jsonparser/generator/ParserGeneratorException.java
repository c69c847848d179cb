package com.jsonparser.generator;

/**
 * Base type of every failure reported by the schema-to-parser pipeline.
 */
public abstract class ParserGeneratorException extends Exception {

    private static final long serialVersionUID = 1L;

    protected ParserGeneratorException(String message) {
        super(message);
    }

    protected ParserGeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
