package com.expense8.core;

import com.expense8.core.search.Algorithm;
import com.expense8.core.search.GraphSearchEngine;
import com.expense8.core.search.SearchConstraints;
import com.expense8.core.search.SearchResult;
import com.expense8.core.search.SearchStatistics;
import com.expense8.core.search.Searcher;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end solving one puzzle with the selected strategy.
 *
 * <p>Usage: {@code Expense8CLI <start_file> <goal_file> [method] [--dump] [dls_limit] [--max-depth=N]}.
 * Exit codes: {@value #EXIT_SOLVED} solved, {@value #EXIT_USAGE} usage error, {@value #EXIT_INPUT}
 * malformed input or an I/O failure, {@value #EXIT_UNREACHABLE} goal in the other parity class,
 * {@value #EXIT_NO_SOLUTION} search finished without a solution.
 */
public final class Expense8CLI {

    public static final int EXIT_SOLVED = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_INPUT = 2;
    public static final int EXIT_UNREACHABLE = 3;
    public static final int EXIT_NO_SOLUTION = 4;

    private static final Logger LOGGER = Logger.getLogger(Expense8CLI.class.getName());
    private static final String MAX_DEPTH_OPTION = "--max-depth=";

    private Expense8CLI() {
    }

    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err, Paths.get(""));
        if (status != EXIT_SOLVED) {
            System.exit(status);
        }
    }

    /**
     * Runs the command and returns its exit code instead of terminating the JVM.
     *
     * @param traceDirectory directory receiving the trace file when {@code --dump} is given
     */
    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err, Path traceDirectory) {
        List<String> positional = new ArrayList<>();
        boolean dump = false;
        int maxDepth = SearchConstraints.DEFAULT_MAX_DEPTH;
        try {
            for (String arg : args) {
                if ("--dump".equals(arg) || "-d".equals(arg)) {
                    dump = true;
                } else if (arg.startsWith(MAX_DEPTH_OPTION)) {
                    maxDepth = parseNonNegative(arg.substring(MAX_DEPTH_OPTION.length()), "--max-depth");
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unrecognised option: " + arg);
                } else {
                    positional.add(arg);
                }
            }
            if (positional.size() < 2 || positional.size() > 4) {
                throw new IllegalArgumentException("Expected a start file, a goal file and a method");
            }
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        Algorithm algorithm;
        try {
            algorithm = positional.size() > 2 ? Algorithm.fromCommand(positional.get(2)) : Algorithm.A_STAR;
            if (algorithm != Algorithm.DLS && positional.size() > 3) {
                throw new IllegalArgumentException("Only dls takes a depth limit");
            }
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        Board start;
        Board goal;
        try {
            start = PuzzleParser.parse(Paths.get(positional.get(0)));
            goal = PuzzleParser.parse(Paths.get(positional.get(1)));
        } catch (InvalidPuzzleException ex) {
            LOGGER.log(Level.FINE, "Rejected puzzle file", ex);
            err.println("Malformed puzzle: " + ex.getMessage());
            return EXIT_INPUT;
        } catch (IOException ex) {
            LOGGER.log(Level.FINE, "Failed to read puzzle file", ex);
            err.println("Cannot read puzzle file: " + ex.getMessage());
            return EXIT_INPUT;
        }

        if (!Parity.sameComponent(start, goal)) {
            err.println("Goal is unreachable from the start board (permutation parity differs).");
            out.println("No solution found.");
            return EXIT_UNREACHABLE;
        }

        SearchConstraints constraints;
        try {
            if (algorithm == Algorithm.DLS) {
                int depthLimit = positional.size() > 3
                        ? parseNonNegative(positional.get(3), "Depth limit")
                        : promptDepthLimit(in, out);
                constraints = new SearchConstraints(algorithm, depthLimit, maxDepth);
            } else {
                constraints = new SearchConstraints(algorithm, SearchConstraints.UNBOUNDED, maxDepth);
            }
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return EXIT_USAGE;
        }

        Searcher searcher = new GraphSearchEngine();
        SearchResult result;
        Path traceFile = null;
        try {
            if (dump) {
                LocalDateTime now = LocalDateTime.now();
                traceFile = TraceWriter.fileFor(traceDirectory, now);
                try (TraceWriter trace = TraceWriter.open(traceDirectory, now, Arrays.asList(args))) {
                    result = searcher.search(start, goal, constraints, trace);
                }
            } else {
                result = searcher.search(start, goal, constraints);
            }
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.log(Level.SEVERE, "Failed to write search trace", ex);
            err.println("Cannot write search trace: " + ex.getMessage());
            return EXIT_INPUT;
        }

        printResult(result, out);
        if (traceFile != null) {
            out.println("Search trace written to " + traceFile);
        }
        return result.isSolved() ? EXIT_SOLVED : EXIT_NO_SOLUTION;
    }

    static void printResult(SearchResult result, PrintStream out) {
        SearchStatistics statistics = result.statistics();
        out.println("Nodes Popped: " + statistics.nodesPopped());
        out.println("Nodes Expanded: " + statistics.nodesExpanded());
        out.println("Nodes Generated: " + statistics.nodesGenerated());
        out.println("Max Fringe Size: " + statistics.maxFringeSize());
        if (!result.isSolved()) {
            out.println("No solution found.");
            return;
        }
        out.printf("Solution Found at depth %d with cost of %d.%n", result.depth(), result.cost());
        out.println("Steps:");
        result.moves().forEach(move -> out.println("\t" + move.label()));
    }

    private static int promptDepthLimit(InputStream in, PrintStream out) {
        out.print("Enter depth limit for DLS: ");
        out.flush();
        Scanner scanner = new Scanner(in, StandardCharsets.UTF_8);
        try {
            return parseNonNegative(scanner.nextLine().trim(), "Depth limit");
        } catch (NoSuchElementException ex) {
            throw new IllegalArgumentException("dls requires a depth limit", ex);
        }
    }

    private static int parseNonNegative(String value, String name) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, ex);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return parsed;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: Expense8CLI <start_file> <goal_file> [a*|greedy|ucs|bfs|dfs|dls|ids] [--dump] "
                + "[dls_limit] [--max-depth=N]");
    }
}
