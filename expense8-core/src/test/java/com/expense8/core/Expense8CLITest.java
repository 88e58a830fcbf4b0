package com.expense8.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class Expense8CLITest {

    @TempDir
    Path tempDir;

    private Path start;
    private Path goal;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void writePuzzles() throws IOException {
        start = tempDir.resolve("start.txt");
        goal = tempDir.resolve("goal.txt");
        Files.writeString(start, "1 2 3\n4 0 5\n7 8 6\nEND\n");
        Files.writeString(goal, "1 2 3\n4 5 6\n7 8 0\nEND\n");
    }

    @Test
    void solvesWithAStarAndPrintsStatistics() {
        int status = run("a*");

        assertEquals(Expense8CLI.EXIT_SOLVED, status);
        List<String> lines = stdoutLines();
        assertEquals(List.of(
                "Nodes Popped: 3",
                "Nodes Expanded: 2",
                "Nodes Generated: 7",
                "Max Fringe Size: 5",
                "Solution Found at depth 2 with cost of 11.",
                "Steps:",
                "\tMove 5 Left",
                "\tMove 6 Up"), lines);
    }

    @Test
    void methodNameIsCaseInsensitiveAndDefaultsToAStar() {
        assertEquals(Expense8CLI.EXIT_SOLVED, run("BFS"));
        assertEquals(Expense8CLI.EXIT_SOLVED, Expense8CLI.run(new String[] {start.toString(), goal.toString()},
                emptyInput(), printStream(out), printStream(err), tempDir));
    }

    @Test
    void rejectsUnknownMethodBeforeReadingFiles() {
        int status = Expense8CLI.run(new String[] {"missing.txt", "missing.txt", "beam"}, emptyInput(),
                printStream(out), printStream(err), tempDir);

        assertEquals(Expense8CLI.EXIT_USAGE, status);
        assertTrue(stderr().contains("Unsupported method: beam"));
    }

    @Test
    void rejectsUnknownOption() {
        assertEquals(Expense8CLI.EXIT_USAGE, run("a*", "--fast"));
    }

    @Test
    void reportsMalformedInput() throws IOException {
        Files.writeString(goal, "1 2 3\n4 5 6\n7 8\nEND\n");

        assertEquals(Expense8CLI.EXIT_INPUT, run("a*"));
        assertTrue(stderr().startsWith("Malformed puzzle: "));
    }

    @Test
    void reportsMissingFile() throws IOException {
        Files.delete(start);

        assertEquals(Expense8CLI.EXIT_INPUT, run("ucs"));
        assertTrue(stderr().startsWith("Cannot read puzzle file: "));
    }

    @Test
    void failsFastOnParityMismatch() throws IOException {
        Files.writeString(goal, "2 1 3\n4 5 6\n7 8 0\nEND\n");

        assertEquals(Expense8CLI.EXIT_UNREACHABLE, run("bfs"));
        assertEquals(List.of("No solution found."), stdoutLines());
    }

    @Test
    void depthLimitedSearchReadsTrailingLimit() {
        assertEquals(Expense8CLI.EXIT_NO_SOLUTION, run("dls", "1"));
        assertTrue(stdoutLines().contains("No solution found."));
    }

    @Test
    void depthLimitedSearchPromptsForMissingLimit() {
        InputStream in = new ByteArrayInputStream("2\n".getBytes(StandardCharsets.UTF_8));
        int status = Expense8CLI.run(new String[] {start.toString(), goal.toString(), "dls"}, in,
                printStream(out), printStream(err), tempDir);

        assertEquals(Expense8CLI.EXIT_SOLVED, status);
        assertTrue(stdout().startsWith("Enter depth limit for DLS: "));
        assertTrue(stdout().contains("Solution Found at depth 2 with cost of 11."));
    }

    @Test
    void depthLimitedSearchWithoutAnswerIsAUsageError() {
        assertEquals(Expense8CLI.EXIT_USAGE, run("dls"));
        assertEquals(Expense8CLI.EXIT_USAGE, run("dls", "-3"));
    }

    @Test
    void dumpWritesTraceFile() throws IOException {
        assertEquals(Expense8CLI.EXIT_SOLVED, run("greedy", "--dump"));

        List<Path> traces;
        try (Stream<Path> files = Files.list(tempDir)) {
            traces = files.filter(file -> file.getFileName().toString().startsWith("trace-"))
                    .collect(Collectors.toList());
        }
        assertEquals(1, traces.size());
        String trace = Files.readString(traces.get(0));
        assertTrue(trace.contains("Method Selected: greedy"));
        assertTrue(trace.contains("Search Finished: SOLVED"));
        assertTrue(stdout().contains("Search trace written to " + traces.get(0)));
    }

    @Test
    void idsHonoursMaxDepthOption() {
        assertEquals(Expense8CLI.EXIT_NO_SOLUTION, run("ids", "--max-depth=1"));
        assertEquals(Expense8CLI.EXIT_SOLVED, run("ids", "--max-depth=2"));
    }

    private int run(String... extra) {
        String[] args = new String[extra.length + 2];
        args[0] = start.toString();
        args[1] = goal.toString();
        System.arraycopy(extra, 0, args, 2, extra.length);
        return Expense8CLI.run(args, emptyInput(), printStream(out), printStream(err), tempDir);
    }

    private static InputStream emptyInput() {
        return new ByteArrayInputStream(new byte[0]);
    }

    private static PrintStream printStream(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private List<String> stdoutLines() {
        return stdout().lines().collect(Collectors.toList());
    }
}
