package com.expense8.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.expense8.core.Direction;
import com.expense8.core.Move;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchResultTest {

    @Test
    void copiesMoves() {
        List<Move> moves = new ArrayList<>(List.of(new Move(5, Direction.LEFT), new Move(6, Direction.UP)));
        SearchResult result = SearchResult.solved(Algorithm.BFS, moves, 11, new SearchStatistics(), null);
        moves.clear();

        assertEquals(2, result.depth());
        assertSame(SearchTelemetry.empty(), result.telemetry());
        assertThrows(UnsupportedOperationException.class, () -> result.moves().add(new Move(1, Direction.UP)));
    }

    @Test
    void failedResultsCarryNoMoves() {
        SearchResult result = SearchResult.failed(Algorithm.DLS, SearchResult.Outcome.DEPTH_EXCEEDED,
                new SearchStatistics(), SearchTelemetry.empty());

        assertEquals(0, result.depth());
        assertEquals(0, result.cost());
        assertThrows(IllegalArgumentException.class, () -> SearchResult.failed(Algorithm.DLS,
                SearchResult.Outcome.SOLVED, new SearchStatistics(), null));
        assertThrows(IllegalArgumentException.class, () -> new SearchResult(Algorithm.BFS,
                SearchResult.Outcome.EXHAUSTED, List.of(new Move(1, Direction.UP)), 1, new SearchStatistics(), null));
    }

    @Test
    void telemetrySumsIterations() {
        SearchTelemetry telemetry = new SearchTelemetry(List.of(
                new SearchTelemetry.Iteration(0, 1, 0, 0, 1, true, 1_000_000L),
                new SearchTelemetry.Iteration(1, 5, 1, 4, 4, false, 500_000L)));

        assertEquals(1_500_000L, telemetry.totalElapsedNanos());
        assertEquals(1.5, telemetry.totalElapsedMillis(), 1e-9);
        assertEquals(1, telemetry.latest().depthLimit());
        assertNull(SearchTelemetry.empty().latest());
    }
}
