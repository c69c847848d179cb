package com.jsonparser.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Rendered C source for one schema: the header followed by the implementation.
 *
 * The header ends at {@link #headerEndMarker}; the builder splits on it.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedSource {

    @NonNull
    String schemaName;

    @NonNull
    String source;

    @NonNull
    String headerEndMarker;

    public String getHeaderFileName() {
        return schemaName + ".h";
    }

    public String getImplementationFileName() {
        return schemaName + ".c";
    }
}
