package com.jsonparser.generator.runtime;

/**
 * How a compiled parser artifact is run for each document.
 */
public enum ExecutionMode {
    /**
     * A fresh process per document, the document passed as the only argument.
     */
    SUBPROCESS,

    /**
     * One long-lived process fed length-framed documents over stdin.
     */
    WORKER
}
