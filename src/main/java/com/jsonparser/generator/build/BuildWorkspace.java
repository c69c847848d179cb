package com.jsonparser.generator.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonparser.generator.util.FileWriteUtil;

/**
 * A directory holding the sources and artifact of one build.
 *
 * Owned by exactly one parser (or by the builder until the parser exists);
 * {@link #close()} removes it and is safe to call more than once.
 */
public final class BuildWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BuildWorkspace.class);

    private final Path directory;
    private final boolean retain;
    private final AtomicBoolean released = new AtomicBoolean();

    private BuildWorkspace(Path directory, boolean retain) {
        this.directory = directory;
        this.retain = retain;
    }

    public static BuildWorkspace create(Path root, String schemaName, boolean retain) throws BuildException {
        try {
            Files.createDirectories(root);
            Path directory = Files.createTempDirectory(root, "parser_" + schemaName + "_");
            log.debug("Created workspace {}", directory);
            return new BuildWorkspace(directory, retain);
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            throw new BuildException(BuildFailure.WORKSPACE_CREATE_FAILED,
                    "failed to create output directory under " + root + ": " + e.getMessage(), e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    public Path write(String fileName, String content) throws BuildException {
        Path file = resolve(fileName);
        try {
            FileWriteUtil.safeWriteString(file, content);
            return file;
        } catch (IOException e) {
            throw new BuildException(BuildFailure.SOURCE_WRITE_FAILED,
                    "failed to write " + fileName + ": " + e.getMessage(), e);
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        if (retain) {
            log.info("Retaining workspace {}", directory);
            return;
        }
        try {
            log.info("Removing workspace {}", directory);
            FileWriteUtil.deleteDirectory(directory);
        } catch (IOException e) {
            log.warn("Could not remove workspace {}: {}", directory, e.getMessage());
        }
    }
}
