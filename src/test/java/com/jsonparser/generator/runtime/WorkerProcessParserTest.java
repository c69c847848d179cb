package com.jsonparser.generator.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.jsonparser.generator.build.BuildWorkspace;
import com.jsonparser.generator.runtime.protocol.WireProtocol;
import com.jsonparser.generator.schema.FieldKind;
import com.jsonparser.generator.schema.FieldSpec;
import com.jsonparser.generator.schema.RecordSchema;
import com.jsonparser.generator.support.NativeToolchain;

import static org.assertj.core.api.Assertions.*;

/**
 * Drives the worker backend with a shell script speaking the length-framed protocol.
 */
class WorkerProcessParserTest {

    private static final RecordSchema ACCOUNT = RecordSchema.of("Account",
            FieldSpec.of("owner", FieldKind.STRING),
            FieldSpec.of("id", FieldKind.INTEGER),
            FieldSpec.of("active", FieldKind.BOOLEAN));

    private static final String SCRIPT = String.join("\n",
            "while read len; do",
            "  doc=$(head -c \"$len\")",
            "  case \"$doc\" in",
            "    *slow*) exec sleep 5 ;;",
            "    *crash*) exit 3 ;;",
            "    *bad*) out='ERROR|Failed to parse JSON' ;;",
            "    *) out=\"SUCCESS|$doc|$$|false\" ;;",
            "  esac",
            "  n=$(printf '%s' \"$out\" | wc -c)",
            "  printf '%s\\n%s' \"$((n))\" \"$out\"",
            "done",
            "");

    @TempDir
    Path tempDir;

    private WorkerProcessParser parser;

    @BeforeEach
    void setUp() throws Exception {
        BuildWorkspace workspace = BuildWorkspace.create(tempDir, "Account", false);
        Path artifact = NativeToolchain.writeScript(workspace.resolve("parser_Account_worker"), SCRIPT);
        parser = new WorkerProcessParser(ACCOUNT, workspace, artifact, WireProtocol.POSITIONAL, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    @Test
    void testSameWorkerServesConsecutiveCalls() throws ParseException {
        ParsedRecord first = parser.parse("alice");
        ParsedRecord second = parser.parse("bob");

        assertThat(first.getString("owner")).isEqualTo("alice");
        assertThat(second.getString("owner")).isEqualTo("bob");
        assertThat(first.getIntegerText("id")).isEqualTo(second.getIntegerText("id"));
        assertThat(parser.getExecutionMode()).isEqualTo(ExecutionMode.WORKER);
    }

    @Test
    void testFailureSentinelKeepsWorker() throws ParseException {
        String pid = parser.parse("alice").getIntegerText("id");

        assertThatThrownBy(() -> parser.parse("bad"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Failed to parse JSON")
                .extracting(e -> ((ParseException) e).getFailure())
                .isEqualTo(ParseFailure.PARSE_FAILURE_SENTINEL);
        assertThat(parser.parse("carol").getIntegerText("id")).isEqualTo(pid);
    }

    @Test
    void testTimeoutRestartsWorker() throws ParseException {
        String pid = parser.parse("alice").getIntegerText("id");

        assertThatThrownBy(() -> parser.parse("slow", Duration.ofMillis(300)))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getFailure())
                .isEqualTo(ParseFailure.TIMED_OUT);

        ParsedRecord after = parser.parse("dave");
        assertThat(after.getString("owner")).isEqualTo("dave");
        assertThat(after.getIntegerText("id")).isNotEqualTo(pid);
    }

    @Test
    void testWorkerExitIsReportedAndRecovered() throws ParseException {
        assertThatThrownBy(() -> parser.parse("crash"))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getFailure())
                .isEqualTo(ParseFailure.PROCESS_SPAWN_FAILED);

        assertThat(parser.parse("erin").getString("owner")).isEqualTo("erin");
    }

    @Test
    void testWorkerThatStopsReadingIsReportedAsGone() throws Exception {
        BuildWorkspace workspace = BuildWorkspace.create(tempDir, "Quitter", false);
        Path artifact = NativeToolchain.writeScript(workspace.resolve("parser_Quitter_worker"), "exit 0\n");
        String document = "x".repeat(256 * 1024);

        try (WorkerProcessParser quitter = new WorkerProcessParser(ACCOUNT, workspace, artifact,
                WireProtocol.POSITIONAL, Duration.ofSeconds(5))) {
            assertThatThrownBy(() -> quitter.parse(document))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("closed its input")
                    .extracting(e -> ((ParseException) e).getFailure())
                    .isEqualTo(ParseFailure.PROCESS_SPAWN_FAILED);
        }
    }

    @Test
    void testNonAsciiDocumentUsesByteLengthFrames() throws ParseException {
        ParsedRecord record = parser.parse("Zo\u00eb \u4e2d");

        assertThat(record.getString("owner")).isEqualTo("Zo\u00eb \u4e2d");
    }

    @Test
    void testConcurrentCallsAreSerialized() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<ParsedRecord>> results = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                String owner = "user" + i;
                results.add(pool.submit(() -> parser.parse(owner)));
            }
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get().getString("owner")).isEqualTo("user" + i);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testCloseStopsWorkerAndRejectsCalls() throws ParseException {
        parser.parse("alice");
        Path directory = parser.getWorkspaceDirectory();

        parser.close();
        parser.close();

        assertThat(directory).doesNotExist();
        assertThatThrownBy(() -> parser.parse("alice")).isInstanceOf(IllegalStateException.class);
    }
}
