package com.jsonparser.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.jsonparser.generator.runtime.ExecutionMode;
import com.jsonparser.generator.runtime.protocol.WireProtocol;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "compile" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CompileOptions {

	@Option(names = { "--schema", "-s" }, required = true, description = "Schema definition file")
	private Path schemaFile;

	@Option(names = { "--document", "-d" }, description = "JSON document to parse (repeatable)")
	private List<String> documents = new ArrayList<>();

	@Option(names = { "--document-file" }, description = "File holding one JSON document (repeatable)")
	private List<Path> documentFiles = new ArrayList<>();

	@Option(names = { "--mode" }, defaultValue = "SUBPROCESS", description = "Execution mode: SUBPROCESS or WORKER")
	private ExecutionMode executionMode;

	@Option(names = { "--protocol" }, defaultValue = "POSITIONAL", description = "Record line layout: POSITIONAL or KEYED")
	private WireProtocol wireProtocol;

	@Option(names = { "--compiler" }, defaultValue = "gcc", description = "C compiler command")
	private String compiler;

	@Option(names = { "--compiler-flag" }, description = "Extra compiler flag (repeatable, default: -O2)")
	private List<String> compilerFlags = new ArrayList<>();

	@Option(names = { "--workspace-dir" }, description = "Root directory for build workspaces (defaults to the system temp directory)")
	private Path workspaceDir;

	@Option(names = { "--emit-dir", "-o" }, description = "Only write the generated C sources to this directory")
	private Path emitDir;

	@Option(names = { "--parse-timeout-ms" }, defaultValue = "10000", description = "Timeout for a single document in milliseconds")
	private long parseTimeoutMs;

	@Option(names = { "--build-timeout-ms" }, defaultValue = "60000", description = "Timeout for the C compiler in milliseconds")
	private long buildTimeoutMs;

	@Option(names = { "--keep-workspace" }, description = "Keep generated sources and the artifact after exit")
	private boolean keepWorkspace;
}
