package com.expense8.core.search;

import com.expense8.core.Board;
import java.util.Objects;

/**
 * Manhattan distance of every tile to its goal cell, weighted by the tile's number.
 *
 * <p>A move shifts one tile {@code t} by one cell at cost {@code t} and changes this sum by
 * exactly {@code t}, so the estimate is consistent and therefore admissible under the expense
 * cost model.
 */
public final class WeightedManhattanHeuristic implements Heuristic {

    private final Board goal;
    private final int[] goalRows = new int[Board.CELL_COUNT];
    private final int[] goalCols = new int[Board.CELL_COUNT];

    public WeightedManhattanHeuristic(Board goal) {
        this.goal = Objects.requireNonNull(goal, "goal");
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            int tile = goal.tileAt(index);
            goalRows[tile] = Board.row(index);
            goalCols[tile] = Board.col(index);
        }
    }

    public Board getGoal() {
        return goal;
    }

    @Override
    public int estimate(Board board) {
        int total = 0;
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            int tile = board.tileAt(index);
            if (tile == Board.BLANK) {
                continue;
            }
            int distance = Math.abs(Board.row(index) - goalRows[tile]) + Math.abs(Board.col(index) - goalCols[tile]);
            total += tile * distance;
        }
        return total;
    }
}
