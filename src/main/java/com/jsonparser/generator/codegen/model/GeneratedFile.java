package com.jsonparser.generator.codegen.model;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One C source file written by {@code emitSources}: where it went, what it
 * holds and which part of the parser it is.
 */
@Value
@Builder
public class GeneratedFile {

    @NonNull
    Path path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;

    public String getFileName() {
        return path.getFileName().toString();
    }

    /** Size of the file on disk; sources are written as UTF-8. */
    public int getSizeInBytes() {
        return contents.getBytes(StandardCharsets.UTF_8).length;
    }
}
