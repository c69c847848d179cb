package com.jsonparser.generator.cli.exception;

import java.util.List;

/**
 * Thrown once per validation pass of the compile command's options, carrying
 * every problem found rather than only the first.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(describe(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("at least one error is required");
        }
        this.errors = List.copyOf(errors);
    }

    private static String describe(List<String> errors) {
        StringBuilder message = new StringBuilder("Invalid compile options (")
                .append(errors.size())
                .append(errors.size() == 1 ? " problem):" : " problems):");
        for (String error : errors) {
            message.append(System.lineSeparator()).append("  - ").append(error);
        }
        return message.toString();
    }

    /** Problems in the order they were found. */
    public List<String> getErrors() {
        return errors;
    }
}
