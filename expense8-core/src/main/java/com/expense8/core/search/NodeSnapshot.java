package com.expense8.core.search;

import com.expense8.core.Board;
import com.expense8.core.Move;
import java.util.Objects;

/**
 * Immutable view of a search node handed to {@link SearchListener}s.
 *
 * @param move     the move that produced the node, {@code null} for the root
 * @param priority the key the frontier orders by: f for A*, h for greedy, g for UCS, depth otherwise
 * @param parent   the parent's board, {@code null} for the root
 */
public record NodeSnapshot(Board board, Move move, int cost, int depth, int priority, Board parent) {

    public NodeSnapshot {
        Objects.requireNonNull(board, "board");
    }

    public String action() {
        return move == null ? "Start" : move.label();
    }
}
