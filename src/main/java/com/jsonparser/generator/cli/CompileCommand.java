package com.jsonparser.generator.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.build.BuildException;
import com.jsonparser.generator.build.ParserBuilder;
import com.jsonparser.generator.cli.exception.OptionsValidationException;
import com.jsonparser.generator.cli.model.CompileOptions;
import com.jsonparser.generator.cli.model.ValidatedCompileOptions;
import com.jsonparser.generator.cli.output.CompileResultsPrinter;
import com.jsonparser.generator.cli.validation.CompileOptionsValidator;
import com.jsonparser.generator.codegen.model.GeneratedFile;
import com.jsonparser.generator.runtime.CompiledParser;
import com.jsonparser.generator.runtime.ParseException;
import com.jsonparser.generator.runtime.ParsedRecord;
import com.jsonparser.generator.schema.validation.SchemaValidationException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that compiles a schema into a native parser and parses documents with it.
 */
@Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        version = "json-parser-generator 1.0.0",
        description = "Compiles a flat record schema into a specialized native JSON parser and runs it over the given documents."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Mixin
    private CompileOptions options = new CompileOptions();

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();

    @Override
    public Integer call() {
        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(validated);
        ParserBuilder builder = new ParserBuilder(validated.getBuildConfig());

        try {
            if (validated.isEmitOnly()) {
                List<GeneratedFile> files = builder.emitSources(validated.getSchema(), validated.getEmitDir());
                printer.printEmitted(files);
                return 0;
            }
            try (CompiledParser parser = builder.build(validated.getSchema())) {
                return parseAll(parser, validated.getDocuments());
            }
        } catch (SchemaValidationException e) {
            printer.printFailure("Schema validation", e.getMessage());
            return 1;
        } catch (BuildException e) {
            printer.printFailure("Build", e.getMessage());
            return 1;
        }
    }

    private int parseAll(CompiledParser parser, List<String> documents) {
        int parsed = 0;
        int failed = 0;
        for (int i = 0; i < documents.size(); i++) {
            try {
                ParsedRecord record = parser.parse(documents.get(i));
                printer.printRecord(i + 1, record);
                parsed++;
            } catch (ParseException e) {
                printer.printParseFailure(i + 1, e.getMessage());
                failed++;
            }
        }
        printer.printSummary(parsed, failed);
        return failed == 0 ? 0 : 1;
    }
}
