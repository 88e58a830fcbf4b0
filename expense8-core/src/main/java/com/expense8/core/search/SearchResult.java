package com.expense8.core.search;

import com.expense8.core.Move;
import java.util.List;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations. Failing to find a solution is a
 * regular outcome carrying the statistics gathered up to that point.
 *
 * @param cost the summed move cost of the solution, {@code 0} when unsolved
 */
public record SearchResult(Algorithm algorithm, Outcome outcome, List<Move> moves, int cost,
        SearchStatistics statistics, SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(statistics, "statistics");
        moves = moves == null ? List.of() : List.copyOf(moves);
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
        if (outcome != Outcome.SOLVED && !moves.isEmpty()) {
            throw new IllegalArgumentException("Only solved results carry moves");
        }
    }

    public static SearchResult solved(Algorithm algorithm, List<Move> moves, int cost,
            SearchStatistics statistics, SearchTelemetry telemetry) {
        return new SearchResult(algorithm, Outcome.SOLVED, moves, cost, statistics, telemetry);
    }

    public static SearchResult failed(Algorithm algorithm, Outcome outcome, SearchStatistics statistics,
            SearchTelemetry telemetry) {
        if (outcome == Outcome.SOLVED) {
            throw new IllegalArgumentException("A failed search cannot be solved");
        }
        return new SearchResult(algorithm, outcome, List.of(), 0, statistics, telemetry);
    }

    public boolean isSolved() {
        return outcome == Outcome.SOLVED;
    }

    /**
     * Returns the number of moves in the solution.
     */
    public int depth() {
        return moves.size();
    }

    /**
     * Terminal states of a search run.
     */
    public enum Outcome {
        SOLVED,
        EXHAUSTED,
        DEPTH_EXCEEDED
    }
}
