package com.jsonparser.generator.runtime;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.build.BuildWorkspace;
import com.jsonparser.generator.runtime.protocol.WireProtocol;
import com.jsonparser.generator.schema.RecordSchema;

/**
 * Keeps one artifact process alive and exchanges documents with it over
 * stdin/stdout. Frames are {@code <byte length>\n<bytes>} in both directions.
 *
 * Exchanges are serialized. A timeout or broken pipe kills the worker along
 * with its reader thread; the next call starts a fresh pair.
 */
public class WorkerProcessParser extends AbstractCompiledParser {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessParser.class);

    private static final int MAX_HEADER_DIGITS = 19;

    private final ReentrantLock exchangeLock = new ReentrantLock();
    private Process worker;
    private ExecutorService reader;

    public WorkerProcessParser(RecordSchema schema, BuildWorkspace workspace, Path artifact,
                               WireProtocol protocol, Duration defaultTimeout) {
        super(schema, workspace, artifact, protocol, defaultTimeout);
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return ExecutionMode.WORKER;
    }

    @Override
    protected String execute(String document, Duration timeout) throws ParseException {
        exchangeLock.lock();
        try {
            Process process = ensureWorker();
            String payload = exchange(process, document, timeout);
            if (!payload.startsWith(WireProtocol.SUCCESS_SENTINEL)) {
                throw getDecoder().rejected(payload);
            }
            return payload;
        } finally {
            exchangeLock.unlock();
        }
    }

    private Process ensureWorker() throws ParseException {
        if (worker != null && worker.isAlive()) {
            return worker;
        }
        shutdownReader();
        try {
            worker = new ProcessBuilder(getArtifact().toString())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            reader = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "parser-worker-" + getSchema().getName());
                thread.setDaemon(true);
                return thread;
            });
            log.debug("Started worker process {} for {}", worker.pid(), getSchema().getName());
            return worker;
        } catch (IOException e) {
            worker = null;
            throw new ParseException(ParseFailure.PROCESS_SPAWN_FAILED,
                    "could not start worker process: " + e.getMessage(), e);
        }
    }

    private String exchange(Process process, String document, Duration timeout) throws ParseException {
        Future<String> response = reader.submit(() -> {
            try {
                writeFrame(process.getOutputStream(), document.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw workerGone("worker closed its input: " + e.getMessage(), e);
            }
            return readFrame(process.getInputStream());
        });

        try {
            return response.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            response.cancel(true);
            killWorker();
            throw new ParseException(ParseFailure.TIMED_OUT,
                    "worker did not answer within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.cancel(true);
            killWorker();
            throw new ParseException(ParseFailure.TIMED_OUT, "worker exchange interrupted", e);
        } catch (ExecutionException e) {
            killWorker();
            Throwable cause = e.getCause();
            ParseFailure failure = cause instanceof EOFException
                    ? ParseFailure.PROCESS_SPAWN_FAILED
                    : ParseFailure.MALFORMED_OUTPUT;
            throw new ParseException(failure, "worker exchange failed: " + cause.getMessage(), cause);
        }
    }

    // EOFException marks a worker that is no longer there, as opposed to one answering garbage
    private static EOFException workerGone(String message, IOException cause) {
        EOFException gone = new EOFException(message);
        gone.initCause(cause);
        return gone;
    }

    private static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        out.write((payload.length + "\n").getBytes(StandardCharsets.US_ASCII));
        out.write(payload);
        out.flush();
    }

    private static String readFrame(InputStream in) throws IOException {
        int length = readLength(in);
        byte[] payload = in.readNBytes(length);
        if (payload.length != length) {
            throw new EOFException("worker closed its output mid-frame");
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    private static int readLength(InputStream in) throws IOException {
        ByteArrayOutputStream digits = new ByteArrayOutputStream();
        int c;
        while ((c = in.read()) != '\n') {
            if (c == -1) {
                throw new EOFException("worker exited");
            }
            if (c < '0' || c > '9' || digits.size() >= MAX_HEADER_DIGITS) {
                throw new IOException("invalid frame header from worker");
            }
            digits.write(c);
        }
        if (digits.size() == 0) {
            throw new IOException("empty frame header from worker");
        }
        long length = Long.parseLong(digits.toString(StandardCharsets.US_ASCII));
        if (length > Integer.MAX_VALUE) {
            throw new IOException("frame too large: " + length);
        }
        return (int) length;
    }

    private void killWorker() {
        Process process = worker;
        worker = null;
        if (process != null) {
            process.destroyForcibly();
        }
        shutdownReader();
    }

    private void stopWorker() {
        Process process = worker;
        worker = null;
        shutdownReader();
        if (process == null) {
            return;
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Closing worker stdin failed: {}", e.getMessage());
        }
        try {
            if (!process.waitFor(1, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    // A reader blocked on a dead worker's pipe is abandoned, not joined
    private void shutdownReader() {
        ExecutorService current = reader;
        reader = null;
        if (current != null) {
            current.shutdownNow();
        }
    }

    @Override
    protected void releaseBackend() {
        exchangeLock.lock();
        try {
            stopWorker();
        } finally {
            exchangeLock.unlock();
        }
    }
}
