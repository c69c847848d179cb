package com.jsonparser.generator.build;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import com.jsonparser.generator.runtime.ExecutionMode;
import com.jsonparser.generator.runtime.protocol.WireProtocol;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for building compiled parsers.
 */
@Data
@Builder(toBuilder = true)
public class ParserBuildConfig {

    @Builder.Default
    private String compiler = "gcc";

    @Builder.Default
    private List<String> compilerFlags = List.of("-O2");

    /**
     * Directory under which each build gets its own workspace.
     */
    @Builder.Default
    private Path workspaceRoot = Path.of(System.getProperty("java.io.tmpdir"), "json-parser-generator");

    @Builder.Default
    private ExecutionMode executionMode = ExecutionMode.SUBPROCESS;

    @Builder.Default
    private WireProtocol wireProtocol = WireProtocol.POSITIONAL;

    @Builder.Default
    private Duration buildTimeout = Duration.ofSeconds(60);

    /**
     * Default bound on a single parse call.
     */
    @Builder.Default
    private Duration parseTimeout = Duration.ofSeconds(10);

    /**
     * Keep generated sources and the artifact on disk after the parser is closed.
     */
    private boolean retainWorkspace;

    public static ParserBuildConfig defaults() {
        return ParserBuildConfig.builder().build();
    }
}
