package com.jsonparser.generator.build;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.util.ProcessResult;
import com.jsonparser.generator.util.ProcessRunner;

import lombok.RequiredArgsConstructor;

/**
 * Invokes the external C compiler: {@code <compiler> <flags> -o <output> <sources>}.
 */
@RequiredArgsConstructor
public class NativeCompiler {

    private static final Logger log = LoggerFactory.getLogger(NativeCompiler.class);

    private final String compiler;
    private final List<String> flags;
    private final Duration timeout;

    public List<String> command(Path output, List<Path> sources) {
        List<String> command = new ArrayList<>();
        command.add(compiler);
        command.addAll(flags);
        command.add("-o");
        command.add(output.toString());
        sources.forEach(source -> command.add(source.toString()));
        return command;
    }

    /**
     * @return the compiler's combined output
     * @throws BuildException if the compiler cannot run, times out or exits non-zero
     */
    public String compile(Path output, List<Path> sources, Path workingDir) throws BuildException {
        List<String> command = command(output, sources);
        log.debug("Compiling: {}", String.join(" ", command));

        ProcessResult result;
        try {
            result = ProcessRunner.run(command, workingDir, timeout);
        } catch (IOException e) {
            throw new BuildException(BuildFailure.EXTERNAL_BUILD_FAILED,
                    "compilation failed: could not run " + compiler + ": " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new BuildException(BuildFailure.EXTERNAL_BUILD_FAILED,
                    "compilation failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildException(BuildFailure.EXTERNAL_BUILD_FAILED,
                    "compilation interrupted", e);
        }

        if (!result.isSuccess()) {
            throw new BuildException(BuildFailure.EXTERNAL_BUILD_FAILED,
                    "compilation failed: " + compiler + " exited with status " + result.getExitCode(),
                    result.getOutput());
        }
        if (!result.getOutput().isBlank()) {
            log.debug("Compiler output: {}", result.getOutput());
        }
        return result.getOutput();
    }
}
