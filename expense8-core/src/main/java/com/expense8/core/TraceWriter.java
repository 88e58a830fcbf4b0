package com.expense8.core;

import com.expense8.core.search.Algorithm;
import com.expense8.core.search.NodeSnapshot;
import com.expense8.core.search.SearchConstraints;
import com.expense8.core.search.SearchListener;
import com.expense8.core.search.SearchResult;
import com.expense8.core.search.SearchStatistics;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Writes the human readable search trace produced by the {@code --dump} option.
 */
public final class TraceWriter implements SearchListener, Closeable {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");
    private static final String SEPARATOR = "-".repeat(60);

    private final Writer writer;
    private final List<String> arguments;
    private String method = "";

    public TraceWriter(Writer writer, List<String> arguments) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }

    /**
     * Opens a trace file in {@code directory} named after the provided time.
     */
    public static TraceWriter open(Path directory, LocalDateTime time, List<String> arguments) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(fileFor(directory, time), StandardCharsets.UTF_8);
        return new TraceWriter(writer, arguments);
    }

    /**
     * Returns the trace file path for the provided time, for example {@code trace-2024-05-01-13-45-00.txt}.
     */
    public static Path fileFor(Path directory, LocalDateTime time) {
        return directory.resolve("trace-" + FILE_TIMESTAMP.format(time) + ".txt");
    }

    @Override
    public void searchStarted(Algorithm algorithm, Board start, Board goal) {
        method = algorithm.command();
        write("Command-Line Arguments: " + arguments);
        write("Method Selected: " + method);
        write("Start: " + start.toGridString());
        write("Goal: " + goal.toGridString());
    }

    @Override
    public void iterationStarted(int depthLimit, NodeSnapshot root, SearchStatistics statistics) {
        String label = depthLimit == SearchConstraints.UNBOUNDED ? method : method + "(limit=" + depthLimit + ")";
        write("After Initialization");
        writeSnapshot(List.of(root), 0, statistics);
        write("Running " + label);
    }

    @Override
    public void nodeExpanded(NodeSnapshot node, int successors, List<NodeSnapshot> fringe, int closedCount,
            SearchStatistics statistics) {
        write("Generating successors to " + format(node) + ":");
        write("\t" + successors + " successors generated");
        writeSnapshot(fringe, closedCount, statistics);
    }

    @Override
    public void searchFinished(SearchResult result) {
        write("Search Finished: " + result.outcome());
        SearchStatistics statistics = result.statistics();
        write("\tNodes Popped: " + statistics.nodesPopped());
        write("\tNodes Expanded: " + statistics.nodesExpanded());
        write("\tNodes Generated: " + statistics.nodesGenerated());
        write("\tMax Fringe Size: " + statistics.maxFringeSize());
        if (result.isSolved()) {
            write("\tSolution Found at depth " + result.depth() + " with cost of " + result.cost() + ".");
            result.moves().forEach(move -> write("\t\t" + move.label()));
        }
        flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    private void writeSnapshot(List<NodeSnapshot> fringe, int closedCount, SearchStatistics statistics) {
        write("\tClosed: " + closedCount + " boards");
        write("\tFringe: [");
        for (NodeSnapshot entry : fringe) {
            write("\t\t" + format(entry));
        }
        write("\t]");
        write("\tNodes Popped: " + statistics.nodesPopped());
        write("\tNodes Expanded: " + statistics.nodesExpanded());
        write("\tNodes Generated: " + statistics.nodesGenerated());
        write("\tMax Fringe Size: " + statistics.maxFringeSize());
        write(SEPARATOR);
    }

    static String format(NodeSnapshot node) {
        String parent = node.parent() == null ? "Pointer to {None}" : "Pointer to {" + node.parent().toGridString() + "}";
        return String.format("< state = %s, action = {%s} g(n) = %d, d = %d, f(n) = %d, Parent = %s >",
                node.board().toGridString(), node.action(), node.cost(), node.depth(), node.priority(), parent);
    }

    private void write(String line) {
        try {
            writer.write(line);
            writer.write(System.lineSeparator());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write search trace", ex);
        }
    }

    private void flush() {
        try {
            writer.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to flush search trace", ex);
        }
    }
}
