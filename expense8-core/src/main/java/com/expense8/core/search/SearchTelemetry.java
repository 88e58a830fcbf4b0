package com.expense8.core.search;

import java.util.List;

/**
 * Per-pass instrumentation captured during a single {@link Searcher#search} call. Iterative
 * deepening records one iteration per depth limit, every other strategy records exactly one.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of());

    private final List<Iteration> iterations;

    public SearchTelemetry(List<Iteration> iterations) {
        this.iterations = iterations == null ? List.of() : List.copyOf(iterations);
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public List<Iteration> iterations() {
        return iterations;
    }

    public Iteration latest() {
        return iterations.isEmpty() ? null : iterations.get(iterations.size() - 1);
    }

    public long totalElapsedNanos() {
        return iterations.stream().mapToLong(Iteration::elapsedNanos).sum();
    }

    public double totalElapsedMillis() {
        return totalElapsedNanos() / 1_000_000.0;
    }

    /**
     * @param depthLimit the depth limit of the pass, or {@link SearchConstraints#UNBOUNDED}
     * @param cutoff     whether the pass left nodes unexpanded because of the depth limit
     */
    public record Iteration(
            int depthLimit,
            long nodesPopped,
            long nodesExpanded,
            long nodesGenerated,
            long maxFringeSize,
            boolean cutoff,
            long elapsedNanos) {

        public double elapsedMillis() {
            return elapsedNanos / 1_000_000.0;
        }
    }
}
