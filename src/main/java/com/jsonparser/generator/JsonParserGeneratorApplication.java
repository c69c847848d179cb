package com.jsonparser.generator;

import com.jsonparser.generator.cli.CompileCommand;
import picocli.CommandLine;

/**
 * Main entry point for the JSON parser generator.
 * This CLI tool compiles a flat record schema into a native JSON parser and
 * runs it over the given documents.
 */
public class JsonParserGeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CompileCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
