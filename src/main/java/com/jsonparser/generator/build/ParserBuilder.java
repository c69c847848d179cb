package com.jsonparser.generator.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.codegen.CodeGenerator;
import com.jsonparser.generator.codegen.model.GeneratedFile;
import com.jsonparser.generator.codegen.model.GeneratedFileType;
import com.jsonparser.generator.codegen.model.GeneratedSource;
import com.jsonparser.generator.runtime.CompiledParser;
import com.jsonparser.generator.runtime.ExecutionMode;
import com.jsonparser.generator.runtime.ProcessPerCallParser;
import com.jsonparser.generator.runtime.WorkerProcessParser;
import com.jsonparser.generator.schema.RecordSchema;
import com.jsonparser.generator.schema.validation.SchemaValidationException;
import com.jsonparser.generator.schema.validation.SchemaValidator;
import com.jsonparser.generator.util.FileWriteUtil;

/**
 * Turns a schema into a ready-to-use {@link CompiledParser}: validates it,
 * generates the C sources, writes them into a fresh workspace and compiles
 * them together with a driver program.
 */
public class ParserBuilder {
    private static final Logger log = LoggerFactory.getLogger(ParserBuilder.class);

    private final ParserBuildConfig config;
    private final SchemaValidator validator;
    private final CodeGenerator codeGenerator;
    private final NativeCompiler compiler;

    public ParserBuilder() {
        this(ParserBuildConfig.defaults());
    }

    public ParserBuilder(ParserBuildConfig config) {
        this.config = config;
        this.validator = new SchemaValidator();
        this.codeGenerator = new CodeGenerator(config.getWireProtocol());
        this.compiler = new NativeCompiler(config.getCompiler(), config.getCompilerFlags(), config.getBuildTimeout());
    }

    public ParserBuildConfig getConfig() {
        return config;
    }

    /**
     * @throws SchemaValidationException carrying the first violated rule
     */
    public void validate(RecordSchema schema) throws SchemaValidationException {
        validator.requireValid(schema);
    }

    /**
     * Build a parser for the schema. On failure nothing is left on disk.
     */
    public CompiledParser build(RecordSchema schema) throws SchemaValidationException, BuildException {
        String name = schema.getName();
        ExecutionMode mode = config.getExecutionMode();

        log.info("Building {} parser for {} ({} fields)", mode, name, schema.getFieldCount());

        log.info("Step 1: Validating schema...");
        validate(schema);

        log.info("Step 2: Generating C source...");
        GeneratedSource source = codeGenerator.generate(schema);
        SourceUnits units = split(source);
        String driver = codeGenerator.generateDriver(schema, mode);

        log.info("Step 3: Writing sources...");
        BuildWorkspace workspace = BuildWorkspace.create(config.getWorkspaceRoot(), name, config.isRetainWorkspace());
        try {
            workspace.write(source.getHeaderFileName(), units.getHeader());
            Path implementation = workspace.write(source.getImplementationFileName(), units.getImplementation());
            Path driverFile = workspace.write(CodeGenerator.driverFileName(name, mode), driver);

            log.info("Step 4: Compiling with {}...", config.getCompiler());
            Path artifact = workspace.resolve(artifactFileName(name, mode));
            compiler.compile(artifact, List.of(driverFile, implementation), workspace.getDirectory());

            CompiledParser parser = switch (mode) {
                case SUBPROCESS -> new ProcessPerCallParser(schema, workspace, artifact,
                        config.getWireProtocol(), config.getParseTimeout());
                case WORKER -> new WorkerProcessParser(schema, workspace, artifact,
                        config.getWireProtocol(), config.getParseTimeout());
            };
            log.info("Parser for {} ready: {}", name, artifact);
            return parser;
        } catch (BuildException | RuntimeException e) {
            workspace.close();
            throw e;
        }
    }

    /**
     * Write the header, implementation and driver for a schema into
     * {@code outputDir} without compiling them.
     */
    public List<GeneratedFile> emitSources(RecordSchema schema, Path outputDir)
            throws SchemaValidationException, BuildException {
        validate(schema);

        GeneratedSource source = codeGenerator.generate(schema);
        SourceUnits units = split(source);
        ExecutionMode mode = config.getExecutionMode();
        String driver = codeGenerator.generateDriver(schema, mode);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new BuildException(BuildFailure.WORKSPACE_CREATE_FAILED,
                    "failed to create output directory " + outputDir + ": " + e.getMessage(), e);
        }

        List<GeneratedFile> files = List.of(
                GeneratedFile.builder()
                        .path(outputDir.resolve(source.getHeaderFileName()))
                        .contents(units.getHeader())
                        .type(GeneratedFileType.HEADER)
                        .build(),
                GeneratedFile.builder()
                        .path(outputDir.resolve(source.getImplementationFileName()))
                        .contents(units.getImplementation())
                        .type(GeneratedFileType.IMPLEMENTATION)
                        .build(),
                GeneratedFile.builder()
                        .path(outputDir.resolve(CodeGenerator.driverFileName(schema.getName(), mode)))
                        .contents(driver)
                        .type(GeneratedFileType.DRIVER)
                        .build());

        for (GeneratedFile file : files) {
            try {
                FileWriteUtil.safeWriteString(file.getPath(), file.getContents());
                log.info("Wrote {}", file.getPath());
            } catch (IOException e) {
                throw new BuildException(BuildFailure.SOURCE_WRITE_FAILED,
                        "failed to write " + file.getPath() + ": " + e.getMessage(), e);
            }
        }
        return files;
    }

    static String artifactFileName(String schemaName, ExecutionMode mode) {
        return switch (mode) {
            case SUBPROCESS -> "parser_" + schemaName;
            case WORKER -> "parser_" + schemaName + "_worker";
        };
    }

    /**
     * Split the generated source at the header end marker.
     */
    static SourceUnits split(GeneratedSource source) throws BuildException {
        String code = source.getSource();
        String marker = source.getHeaderEndMarker();
        int index = code.indexOf(marker);
        if (index < 0) {
            throw new BuildException(BuildFailure.TEMPLATE_FAILED,
                    "generated source for " + source.getSchemaName() + " has no header end marker");
        }
        int headerEnd = index + marker.length();
        return new SourceUnits(code.substring(0, headerEnd), code.substring(headerEnd));
    }
}
