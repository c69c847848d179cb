package com.jsonparser.generator.runtime;

import java.time.Duration;

import com.jsonparser.generator.schema.RecordSchema;

/**
 * A natively compiled JSON parser for one record schema.
 *
 * Instances are safe for concurrent {@code parse} calls. {@link #close()}
 * waits for in-flight calls, then deletes the generated sources and artifact;
 * any later {@code parse} fails with {@link IllegalStateException}.
 */
public interface CompiledParser extends AutoCloseable {

    RecordSchema getSchema();

    ExecutionMode getExecutionMode();

    /**
     * Parses one document using the configured default timeout.
     *
     * @throws ParseException if the document is rejected or the artifact misbehaves
     */
    ParsedRecord parse(String document) throws ParseException;

    /**
     * Parses one document, giving up after {@code timeout}.
     *
     * @throws ParseException if the document is rejected, the artifact misbehaves or the call times out
     */
    ParsedRecord parse(String document, Duration timeout) throws ParseException;

    boolean isClosed();

    /**
     * Releases the artifact and its workspace. Idempotent.
     */
    @Override
    void close();
}
