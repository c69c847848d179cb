package com.jsonparser.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.jsonparser.generator.build.ParserBuildConfig;
import com.jsonparser.generator.cli.exception.OptionsValidationException;
import com.jsonparser.generator.cli.model.CompileOptions;
import com.jsonparser.generator.cli.model.ValidatedCompileOptions;
import com.jsonparser.generator.schema.RecordSchema;
import com.jsonparser.generator.schema.source.SchemaDefinition;
import com.jsonparser.generator.schema.source.SchemaDefinitionParser;

public class CompileOptionsValidator {

	private final SchemaDefinitionParser schemaParser = new SchemaDefinitionParser();

	public ValidatedCompileOptions validate(CompileOptions o) {
		List<String> errors = new ArrayList<>();

		RecordSchema schema = readSchema(o.getSchemaFile(), errors);

		List<String> documents = new ArrayList<>(o.getDocuments());
		for (Path file : o.getDocumentFiles()) {
			if (!Files.isRegularFile(file)) {
				errors.add("Document file does not exist: " + file);
				continue;
			}
			try {
				documents.add(Files.readString(file));
			} catch (IOException e) {
				errors.add("Could not read document file " + file + ": " + e.getMessage());
			}
		}

		if (o.getEmitDir() == null && documents.isEmpty()) {
			errors.add("Nothing to do: provide --document / --document-file, or --emit-dir to only generate sources.");
		}
		if (o.getEmitDir() != null && Files.exists(o.getEmitDir()) && !Files.isDirectory(o.getEmitDir())) {
			errors.add("Emit directory is not a directory: " + o.getEmitDir());
		}
		if (o.getWorkspaceDir() != null && Files.exists(o.getWorkspaceDir()) && !Files.isDirectory(o.getWorkspaceDir())) {
			errors.add("Workspace directory is not a directory: " + o.getWorkspaceDir());
		}

		if (isBlank(o.getCompiler())) {
			errors.add("Compiler command must not be blank (--compiler).");
		}
		if (o.getParseTimeoutMs() <= 0) {
			errors.add("Parse timeout must be > 0. Got: " + o.getParseTimeoutMs());
		}
		if (o.getBuildTimeoutMs() <= 0) {
			errors.add("Build timeout must be > 0. Got: " + o.getBuildTimeoutMs());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedCompileOptions(schema, List.copyOf(documents), buildConfig(o), o.getEmitDir());
	}

	private RecordSchema readSchema(Path schemaFile, List<String> errors) {
		if (schemaFile == null || !Files.isRegularFile(schemaFile)) {
			errors.add("Schema file does not exist: " + schemaFile);
			return null;
		}
		try {
			SchemaDefinition definition = schemaParser.parse(schemaFile);
			if (definition.hasErrors()) {
				definition.getErrors().forEach(error -> errors.add("Schema " + schemaFile + ": " + error));
				return null;
			}
			return definition.toSchema();
		} catch (IOException e) {
			errors.add("Could not read schema file " + schemaFile + ": " + e.getMessage());
			return null;
		}
	}

	private static ParserBuildConfig buildConfig(CompileOptions o) {
		ParserBuildConfig.ParserBuildConfigBuilder builder = ParserBuildConfig.builder()
				.compiler(o.getCompiler())
				.executionMode(o.getExecutionMode())
				.wireProtocol(o.getWireProtocol())
				.parseTimeout(Duration.ofMillis(o.getParseTimeoutMs()))
				.buildTimeout(Duration.ofMillis(o.getBuildTimeoutMs()))
				.retainWorkspace(o.isKeepWorkspace());
		if (!o.getCompilerFlags().isEmpty()) {
			builder.compilerFlags(List.copyOf(o.getCompilerFlags()));
		}
		if (o.getWorkspaceDir() != null) {
			builder.workspaceRoot(o.getWorkspaceDir().toAbsolutePath().normalize());
		}
		return builder.build();
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
