package com.jsonparser.generator.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import com.jsonparser.generator.build.BuildWorkspace;
import com.jsonparser.generator.runtime.protocol.WireProtocol;
import com.jsonparser.generator.schema.RecordSchema;
import com.jsonparser.generator.util.ProcessResult;
import com.jsonparser.generator.util.ProcessRunner;

/**
 * Spawns the artifact once per document. The artifact is started with
 * {@code -} and reads the document from stdin as UTF-8 bytes.
 */
public class ProcessPerCallParser extends AbstractCompiledParser {

    static final String STDIN_ARGUMENT = "-";

    public ProcessPerCallParser(RecordSchema schema, BuildWorkspace workspace, Path artifact,
                                WireProtocol protocol, Duration defaultTimeout) {
        super(schema, workspace, artifact, protocol, defaultTimeout);
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return ExecutionMode.SUBPROCESS;
    }

    @Override
    protected String execute(String document, Duration timeout) throws ParseException {
        ProcessResult result;
        try {
            result = ProcessRunner.run(List.of(getArtifact().toString(), STDIN_ARGUMENT), null,
                    document.getBytes(StandardCharsets.UTF_8), timeout);
        } catch (IOException e) {
            throw new ParseException(ParseFailure.PROCESS_SPAWN_FAILED,
                    "parser execution failed: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new ParseException(ParseFailure.TIMED_OUT, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ParseException(ParseFailure.TIMED_OUT, "parser execution interrupted", e);
        }

        if (!result.isSuccess()) {
            throw getDecoder().rejected(result.getOutput());
        }
        return result.getOutput();
    }
}
