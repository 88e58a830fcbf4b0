package com.expense8.core.search;

import com.expense8.core.Board;

/**
 * Generic interface for puzzle search implementations.
 */
public interface Searcher {

    /**
     * Searches for a sequence of moves turning {@code start} into {@code goal}.
     *
     * @param start the board to start from
     * @param goal the board to reach
     * @param constraints the strategy and limits guiding the search
     * @param listener receives the trace events of the run
     * @return the outcome of the search, which is never {@code null}
     */
    SearchResult search(Board start, Board goal, SearchConstraints constraints, SearchListener listener);

    default SearchResult search(Board start, Board goal, SearchConstraints constraints) {
        return search(start, goal, constraints, SearchListener.NONE);
    }
}
