package com.jsonparser.generator.runtime;

import com.jsonparser.generator.ParserGeneratorException;

/**
 * Thrown when a document could not be parsed by a compiled parser.
 */
public class ParseException extends ParserGeneratorException {

    private static final long serialVersionUID = 1L;

    private final ParseFailure failure;
    private final String rawOutput;

    public ParseException(ParseFailure failure, String message, String rawOutput) {
        super(describe(message, rawOutput));
        this.failure = failure;
        this.rawOutput = rawOutput;
    }

    public ParseException(ParseFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.rawOutput = null;
    }

    public ParseFailure getFailure() {
        return failure;
    }

    /**
     * Output captured from the artifact, or {@code null} when none was read.
     */
    public String getRawOutput() {
        return rawOutput;
    }

    private static String describe(String message, String rawOutput) {
        if (rawOutput == null || rawOutput.isEmpty()) {
            return message;
        }
        return message + System.lineSeparator() + "Output: " + rawOutput;
    }
}
