package com.jsonparser.generator.util;

import lombok.Value;

/**
 * Exit status and combined stdout/stderr of a finished process.
 */
@Value
public class ProcessResult {
    int exitCode;
    String output;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
