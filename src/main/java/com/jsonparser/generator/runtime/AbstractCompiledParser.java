package com.jsonparser.generator.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.build.BuildWorkspace;
import com.jsonparser.generator.runtime.protocol.ResultDecoder;
import com.jsonparser.generator.runtime.protocol.WireProtocol;
import com.jsonparser.generator.schema.RecordSchema;

/**
 * Lifecycle shared by the parser backends: parses hold a shared lock, close
 * takes the exclusive one, so the workspace is never removed under a running call.
 */
public abstract class AbstractCompiledParser implements CompiledParser {

    private static final Logger log = LoggerFactory.getLogger(AbstractCompiledParser.class);

    private final RecordSchema schema;
    private final BuildWorkspace workspace;
    private final Path artifact;
    private final Duration defaultTimeout;
    private final ResultDecoder decoder;
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile boolean closed;

    protected AbstractCompiledParser(RecordSchema schema, BuildWorkspace workspace, Path artifact,
                                     WireProtocol protocol, Duration defaultTimeout) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.artifact = Objects.requireNonNull(artifact, "artifact");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        this.decoder = new ResultDecoder(schema.getFields(), protocol);
    }

    @Override
    public RecordSchema getSchema() {
        return schema;
    }

    public Path getArtifact() {
        return artifact;
    }

    public Path getWorkspaceDirectory() {
        return workspace.getDirectory();
    }

    @Override
    public ParsedRecord parse(String document) throws ParseException {
        return parse(document, defaultTimeout);
    }

    @Override
    public ParsedRecord parse(String document, Duration timeout) throws ParseException {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(timeout, "timeout");

        lifecycle.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Parser for " + schema.getName() + " is closed");
            }
            String output = execute(document, timeout);
            log.debug("Parser output for {}: {}", schema.getName(), output);
            return decoder.decode(output);
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            releaseBackend();
            workspace.close();
            log.info("Closed parser for {}", schema.getName());
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    protected ResultDecoder getDecoder() {
        return decoder;
    }

    /**
     * Runs the artifact on one document and returns its record line.
     * Implementations throw when the artifact reports failure.
     */
    protected abstract String execute(String document, Duration timeout) throws ParseException;

    /**
     * Stops anything the backend keeps running. Called once, before the workspace is deleted.
     */
    protected void releaseBackend() {
    }
}
