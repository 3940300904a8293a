package org.jsondelta.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.bson.Document;
import org.jsondelta.engine.KeyScope;
import org.jsondelta.engine.OneSidedMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonDiffLauncherTest {
    private static final String LEFT = """
            {"items": [{"id": "a", "v": 1}, {"id": "b", "v": 2}]}
            """;
    private static final String RIGHT = """
            {"items": [{"id": "b", "v": 3}, {"id": "a", "v": 1}, {"id": "c", "v": 9}]}
            """;

    @Test
    void reportsDifferencesAsMarkdownAndExitsWithOne(@TempDir final Path tempDir) throws Exception {
        final Path left = write(tempDir, "left.json", LEFT);
        final Path right = write(tempDir, "right.json", RIGHT);
        final ByteArrayOutputStream out = new ByteArrayOutputStream();

        final int exitCode = JsonDiffLauncher.run(
                new String[] {"--left=" + left, "--right=" + right},
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(JsonDiffLauncher.EXIT_DIFFERENT, exitCode);
        final String markdown = out.toString(StandardCharsets.UTF_8);
        assertTrue(markdown.contains("- left: left.json"));
        assertTrue(markdown.contains(
                "- CHANGED `items[id=b].v`: `2` -> `3` (left.json `items[1].v`, right.json `items[0].v`)"));
        assertTrue(markdown.contains("- ADDED `items[id=c]`"));
    }

    @Test
    void exitsWithZeroWhenEveryDifferenceIsIgnored(@TempDir final Path tempDir) throws Exception {
        final Path left = write(tempDir, "left.json", LEFT);
        final Path right = write(tempDir, "right.json", RIGHT);

        final int exitCode = JsonDiffLauncher.run(
                new String[] {
                    "--left=" + left,
                    "--right=" + right,
                    "--ignore=items.*.v",
                    "--ignore=items[id=c]"
                },
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(JsonDiffLauncher.EXIT_SAME, exitCode);
    }

    @Test
    void writesJsonReportAndAcceptsYamlInput(@TempDir final Path tempDir) throws Exception {
        final Path left = write(
                tempDir,
                "left.yaml",
                """
                items:
                  - id: a
                    v: 1
                  - id: b
                    v: 2
                """);
        final Path right = write(tempDir, "right.json", RIGHT);
        final ByteArrayOutputStream out = new ByteArrayOutputStream();

        final int exitCode = JsonDiffLauncher.run(
                new String[] {"--left=" + left, "--right=" + right, "--format=json"},
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(JsonDiffLauncher.EXIT_DIFFERENT, exitCode);
        final Document report = Document.parse(out.toString(StandardCharsets.UTF_8));
        assertEquals("left.yaml", report.getString("left"));
        assertEquals(2, report.get("summary", Document.class).getInteger("differences"));
        assertEquals(
                "items[id=b].v",
                report.getList("diffs", Document.class).get(0).getString("identityAddress"));
    }

    @Test
    void identicalInputsExitWithZero(@TempDir final Path tempDir) throws Exception {
        final Path left = write(tempDir, "left.json", LEFT);
        final Path right = write(
                tempDir,
                "right.json",
                """
                {"items": [{"id": "b", "v": 2}, {"id": "a", "v": 1}]}
                """);
        final ByteArrayOutputStream out = new ByteArrayOutputStream();

        final int exitCode = JsonDiffLauncher.run(
                new String[] {"--left=" + left, "--right=" + right},
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(JsonDiffLauncher.EXIT_SAME, exitCode);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("- No differences"));
    }

    @Test
    void logsToStderrWhenRequested(@TempDir final Path tempDir) throws Exception {
        final Path left = write(tempDir, "left.json", LEFT);
        final Path right = write(tempDir, "right.json", RIGHT);
        final ByteArrayOutputStream err = new ByteArrayOutputStream();

        JsonDiffLauncher.run(
                new String[] {"--left=" + left, "--right=" + right, "--log=stderr"},
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        final List<String> lines = err.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(2, lines.size());
        final Document complete = Document.parse(lines.get(1));
        assertEquals("compare.complete", complete.getString("message"));
        assertEquals(left.toString(), complete.getString("leftSource"));
    }

    @Test
    void rejectsBadArgumentsWithUsage() {
        final ByteArrayOutputStream err = new ByteArrayOutputStream();

        final int missing = JsonDiffLauncher.run(
                new String[] {"--left=a.json"},
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        final int unknown = JsonDiffLauncher.run(
                new String[] {"--left=a.json", "--right=b.json", "--colour=always"},
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        final int badPattern = JsonDiffLauncher.run(
                new String[] {"--left=a.json", "--right=b.json", "--ignore=items["},
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(JsonDiffLauncher.EXIT_ERROR, missing);
        assertEquals(JsonDiffLauncher.EXIT_ERROR, unknown);
        assertEquals(JsonDiffLauncher.EXIT_ERROR, badPattern);
        final String messages = err.toString(StandardCharsets.UTF_8);
        assertTrue(messages.contains("--left and --right are required"));
        assertTrue(messages.contains("unsupported argument: --colour=always"));
        assertTrue(messages.contains("Usage: JsonDiffLauncher"));
    }

    @Test
    void reportsUnreadableInput(@TempDir final Path tempDir) throws Exception {
        final Path left = write(tempDir, "left.json", "{\"items\": [");
        final ByteArrayOutputStream err = new ByteArrayOutputStream();

        final int malformed = JsonDiffLauncher.run(
                new String[] {"--left=" + left, "--right=" + left},
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        final int absent = JsonDiffLauncher.run(
                new String[] {"--left=" + tempDir.resolve("missing.json"), "--right=" + left},
                new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(JsonDiffLauncher.EXIT_ERROR, malformed);
        assertEquals(JsonDiffLauncher.EXIT_ERROR, absent);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("cannot read input: "));
    }

    @Test
    void printsUsageForHelp() {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();

        final int exitCode = JsonDiffLauncher.run(
                new String[] {"--help"},
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(new ByteArrayOutputStream()));

        assertEquals(JsonDiffLauncher.EXIT_SAME, exitCode);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("--key-scope=location|pattern"));
    }

    @Test
    void parsesComparisonOptions() {
        final JsonDiffLauncher.LaunchConfig config = JsonDiffLauncher.LaunchConfig.parse(new String[] {
            "--left=a.json",
            "--right=b.json",
            "--format=md",
            "--one-sided=expand",
            "--key-scope=pattern",
            "--min-overlap=0.25",
            "--min-array-size=3",
            "--preferred-keys=uuid, id"
        });

        assertEquals(JsonDiffLauncher.ReportFormat.MARKDOWN, config.format());
        assertEquals(OneSidedMode.EXPAND, config.compareOptions().oneSidedMode());
        assertEquals(KeyScope.PATTERN, config.compareOptions().keyScope());
        assertEquals(0.25, config.compareOptions().detector().minOverlapRatio());
        assertEquals(3, config.compareOptions().detector().minArraySize());
        assertEquals(List.of("uuid", "id"), config.compareOptions().detector().preferredKeys());
        assertThrows(
                IllegalArgumentException.class,
                () -> JsonDiffLauncher.LaunchConfig.parse(new String[] {"--left=a", "--right=b", "--min-overlap=2"}));
    }

    private static Path write(final Path dir, final String name, final String content) throws Exception {
        final Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
