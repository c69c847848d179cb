package com.jsonparser.generator.build;

import com.jsonparser.generator.ParserGeneratorException;

/**
 * Thrown when generated sources cannot be rendered, written or compiled.
 */
public class BuildException extends ParserGeneratorException {

    private static final long serialVersionUID = 1L;

    private final BuildFailure failure;
    private final String toolOutput;

    public BuildException(BuildFailure failure, String message) {
        super(message);
        this.failure = failure;
        this.toolOutput = null;
    }

    public BuildException(BuildFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.toolOutput = null;
    }

    public BuildException(BuildFailure failure, String message, String toolOutput) {
        super(toolOutput == null || toolOutput.isBlank()
                ? message
                : message + System.lineSeparator() + "Output: " + toolOutput);
        this.failure = failure;
        this.toolOutput = toolOutput;
    }

    public BuildFailure getFailure() {
        return failure;
    }

    /**
     * Combined stdout/stderr of the compiler, when it ran.
     */
    public String getToolOutput() {
        return toolOutput;
    }
}
