package com.jsonparser.generator.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external command to completion with a bounded wait.
 *
 * Each process gets its own daemon threads for feeding stdin and draining
 * stdout, so a call never depends on a shared pool having a free worker.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private ProcessRunner() {
        // Utility class
    }

    /**
     * Starts the command with stderr merged into stdout and an empty stdin,
     * and waits for it to exit.
     *
     * @see #run(List, Path, byte[], Duration)
     */
    public static ProcessResult run(List<String> command, Path workingDir, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        return run(command, workingDir, null, timeout);
    }

    /**
     * Starts the command with stderr merged into stdout, writes {@code input}
     * to its stdin and waits for it to exit.
     *
     * @param command    program and arguments
     * @param workingDir working directory, or {@code null} for the current one
     * @param input      bytes for stdin, or {@code null} for none
     * @param timeout    maximum time to wait; the process is killed when exceeded
     * @throws IOException          if the process cannot be started or its output cannot be read
     * @throws TimeoutException     if the process did not exit in time
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public static ProcessResult run(List<String> command, Path workingDir, byte[] input, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectErrorStream(true);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }

        Process process = pb.start();
        String name = command.get(0);
        FutureTask<String> output = new FutureTask<>(() -> readAll(process.getInputStream()));
        startDaemon(output, "process-output-" + process.pid());

        if (input == null) {
            process.getOutputStream().close();
        } else {
            startDaemon(() -> feed(process.getOutputStream(), input, name), "process-input-" + process.pid());
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TimeoutException("Process did not finish within " + timeout.toMillis() + " ms: " + name);
            }
            return new ProcessResult(process.exitValue(), output.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to read output of " + name, cause);
        }
    }

    private static void startDaemon(Runnable task, String threadName) {
        Thread thread = new Thread(task, threadName);
        thread.setDaemon(true);
        thread.start();
    }

    // A process may exit without reading all of stdin; its exit status reports the outcome.
    private static void feed(OutputStream stdin, byte[] input, String name) {
        try (stdin) {
            stdin.write(input);
        } catch (IOException e) {
            log.debug("Could not write stdin of {}: {}", name, e.getMessage());
        }
    }

    private static String readAll(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
