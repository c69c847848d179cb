package com.jsonparser.generator.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class BuildWorkspaceTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreateUniqueDirectoriesPerBuild() throws BuildException {
        try (BuildWorkspace first = BuildWorkspace.create(tempDir, "Person", false);
             BuildWorkspace second = BuildWorkspace.create(tempDir, "Person", false)) {
            assertThat(first.getDirectory()).isDirectory();
            assertThat(second.getDirectory()).isDirectory();
            assertThat(first.getDirectory()).isNotEqualTo(second.getDirectory());
            assertThat(first.getDirectory().getFileName().toString()).startsWith("parser_Person_");
        }
    }

    @Test
    void testCloseRemovesDirectory() throws BuildException {
        BuildWorkspace workspace = BuildWorkspace.create(tempDir.resolve("nested"), "Person", false);
        Path written = workspace.write("Person.h", "// header\n");
        assertThat(written).hasContent("// header\n");

        workspace.close();

        assertThat(workspace.isReleased()).isTrue();
        assertThat(workspace.getDirectory()).doesNotExist();
    }

    @Test
    void testCloseIsIdempotent() throws BuildException {
        BuildWorkspace workspace = BuildWorkspace.create(tempDir, "Person", false);

        workspace.close();
        workspace.close();

        assertThat(workspace.getDirectory()).doesNotExist();
    }

    @Test
    void testRetainKeepsDirectory() throws BuildException {
        BuildWorkspace workspace = BuildWorkspace.create(tempDir, "Person", true);
        workspace.write("Person.c", "int x;\n");

        workspace.close();

        assertThat(workspace.resolve("Person.c")).exists();
    }

    @Test
    void testRootIsAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("occupied"), "x");

        assertThatThrownBy(() -> BuildWorkspace.create(file, "Person", false))
                .isInstanceOf(BuildException.class)
                .hasMessageContaining("failed to create output directory")
                .extracting(e -> ((BuildException) e).getFailure())
                .isEqualTo(BuildFailure.WORKSPACE_CREATE_FAILED);
    }
}
