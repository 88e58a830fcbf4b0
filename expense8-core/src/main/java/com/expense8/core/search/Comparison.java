package com.expense8.core.search;

import com.expense8.core.Board;
import com.expense8.core.Parity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs every {@link Algorithm} on the same problem so their statistics can be compared.
 */
public final class Comparison {

    private static final Logger LOGGER = Logger.getLogger(Comparison.class.getName());

    private final Searcher searcher;
    private final int dlsLimit;
    private final int idsMaxDepth;

    public Comparison(int dlsLimit) {
        this(new GraphSearchEngine(), dlsLimit, SearchConstraints.DEFAULT_MAX_DEPTH);
    }

    public Comparison(Searcher searcher, int dlsLimit, int idsMaxDepth) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        if (dlsLimit < 0) {
            throw new IllegalArgumentException("DLS limit must not be negative");
        }
        if (idsMaxDepth < 0) {
            throw new IllegalArgumentException("IDS maximum depth must not be negative");
        }
        this.dlsLimit = dlsLimit;
        this.idsMaxDepth = idsMaxDepth;
    }

    /**
     * Returns one result per algorithm, in declaration order.
     *
     * @throws IllegalArgumentException if the goal lies in the other parity class than the start
     */
    public List<SearchResult> run(Board start, Board goal) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        if (!Parity.sameComponent(start, goal)) {
            throw new IllegalArgumentException("Goal " + goal + " is unreachable from " + start);
        }
        List<SearchResult> results = new ArrayList<>();
        for (Algorithm algorithm : Algorithm.values()) {
            SearchResult result = searcher.search(start, goal, constraintsFor(algorithm));
            results.add(result);
            LOGGER.info(() -> String.format("Compared %s: %s in %.2f ms", algorithm.command(), result.outcome(),
                    result.telemetry().totalElapsedMillis()));
        }
        return results;
    }

    private SearchConstraints constraintsFor(Algorithm algorithm) {
        int depthLimit = algorithm == Algorithm.DLS ? dlsLimit : SearchConstraints.UNBOUNDED;
        return new SearchConstraints(algorithm, depthLimit, idsMaxDepth);
    }

    /**
     * Formats results as a fixed-width table with one row per algorithm.
     */
    public static String formatTable(List<SearchResult> results) {
        StringBuilder table = new StringBuilder();
        table.append(String.format("%-8s %-15s %10s %10s %10s %10s %7s %7s %10s%n", "Method", "Outcome", "Popped",
                "Expanded", "Generated", "MaxFringe", "Depth", "Cost", "Millis"));
        for (SearchResult result : results) {
            SearchStatistics statistics = result.statistics();
            table.append(String.format("%-8s %-15s %10d %10d %10d %10d %7s %7s %10.2f%n",
                    result.algorithm().command(), result.outcome(), statistics.nodesPopped(),
                    statistics.nodesExpanded(), statistics.nodesGenerated(), statistics.maxFringeSize(),
                    result.isSolved() ? Integer.toString(result.depth()) : "-",
                    result.isSolved() ? Integer.toString(result.cost()) : "-",
                    result.telemetry().totalElapsedMillis()));
        }
        return table.toString();
    }
}
