package com.jsonparser.generator.cli.output;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.cli.model.ValidatedCompileOptions;
import com.jsonparser.generator.codegen.model.GeneratedFile;
import com.jsonparser.generator.runtime.ParsedRecord;
import com.jsonparser.generator.schema.FieldSpec;

/**
 * Responsible only for printing CLI output for the "compile" command.
 * No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(ValidatedCompileOptions v) {
        log.info("=================================================");
        log.info("JSON Parser Generator");
        log.info("=================================================");
        log.info("Record: {}", v.getSchema().getName());
        for (FieldSpec field : v.getSchema().getFields()) {
            log.info("  {} : {}", field.getName(), field.getDeclaredType());
        }
        if (v.isEmitOnly()) {
            log.info("Emit Directory: {}", v.getEmitDir().toAbsolutePath());
        } else {
            log.info("Execution Mode: {}", v.getBuildConfig().getExecutionMode());
            log.info("Wire Protocol: {}", v.getBuildConfig().getWireProtocol());
            log.info("Compiler: {} {}", v.getBuildConfig().getCompiler(),
                    String.join(" ", v.getBuildConfig().getCompilerFlags()));
            log.info("Workspace Root: {}", v.getBuildConfig().getWorkspaceRoot());
            log.info("Documents: {}", v.getDocuments().size());
        }
        log.info("=================================================");
    }

    public void printEmitted(List<GeneratedFile> files) {
        log.info("");
        log.info("=================================================");
        log.info("SOURCES GENERATED");
        log.info("=================================================");
        for (GeneratedFile file : files) {
            log.info("  {} {} ({} bytes) in {}", file.getType(), file.getFileName(), file.getSizeInBytes(),
                    file.getPath().toAbsolutePath().getParent());
        }
        log.info("=================================================");
    }

    public void printRecord(int index, ParsedRecord record) {
        log.info("Document {}: parsed", index);
        for (Map.Entry<String, Object> entry : record.asMap().entrySet()) {
            log.info("  {} = {}", entry.getKey(), entry.getValue());
        }
    }

    public void printParseFailure(int index, String message) {
        log.error("Document {}: {}", index, message);
    }

    public void printSummary(int parsed, int failed) {
        log.info("=================================================");
        log.info("Parsed: {}  Failed: {}", parsed, failed);
        log.info("=================================================");
    }

    public void printFailure(String stage, String message) {
        log.error("{} failed: {}", stage, message);
    }
}
