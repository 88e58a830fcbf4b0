package com.expense8.core.search;

import com.expense8.core.Board;

/**
 * Estimate of the remaining cost from a board to the goal the heuristic was built for.
 *
 * <p>A* returns optimal solutions only if the estimate is admissible (it never exceeds the true
 * remaining cost) and expands every board at most once if it is also consistent.
 */
public interface Heuristic {

    int estimate(Board board);
}
