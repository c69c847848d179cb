package com.jsonparser.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.jsonparser.generator.build.ParserBuildConfig;
import com.jsonparser.generator.schema.RecordSchema;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {
    RecordSchema schema;
    List<String> documents;
    ParserBuildConfig buildConfig;
    Path emitDir;

    public boolean isEmitOnly() {
        return emitDir != null;
    }
}
