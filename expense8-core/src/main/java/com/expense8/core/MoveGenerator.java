package com.expense8.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates the legal successors of a board.
 *
 * <p>For every blank position the neighbouring cells are precomputed in a fixed order: the cell
 * above the blank, below it, to its left and to its right. A tile above the blank slides down, a
 * tile below slides up, and so on. This order decides tie-breaks in the frontier and therefore which
 * solution depth-first and greedy searches report, so it must not change.
 */
public final class MoveGenerator {

    private static final Direction[] BLANK_SCAN_ORDER = {
            Direction.UP, Direction.DOWN, Direction.LEFT, Direction.RIGHT
    };

    private static final int[][] NEIGHBOURS;
    private static final Direction[][] TILE_DIRECTIONS;

    static {
        int[][] neighbours = new int[Board.CELL_COUNT][];
        Direction[][] directions = new Direction[Board.CELL_COUNT][];
        for (int blank = 0; blank < Board.CELL_COUNT; blank++) {
            int[] cells = new int[BLANK_SCAN_ORDER.length];
            Direction[] tileDirections = new Direction[BLANK_SCAN_ORDER.length];
            int count = 0;
            for (Direction direction : BLANK_SCAN_ORDER) {
                int row = Board.row(blank) + direction.rowDelta();
                int col = Board.col(blank) + direction.colDelta();
                if (row < 0 || row >= Board.SIZE || col < 0 || col >= Board.SIZE) {
                    continue;
                }
                cells[count] = Board.index(row, col);
                tileDirections[count] = direction.opposite();
                count++;
            }
            if (count < 2) {
                throw new IllegalStateException("Cell " + blank + " has only " + count + " neighbours");
            }
            neighbours[blank] = Arrays.copyOf(cells, count);
            directions[blank] = Arrays.copyOf(tileDirections, count);
        }
        NEIGHBOURS = neighbours;
        TILE_DIRECTIONS = directions;
    }

    private MoveGenerator() {
    }

    /**
     * Returns the successors of the provided board in the documented order.
     */
    public static List<Successor> successors(Board board) {
        Objects.requireNonNull(board, "board");
        int blank = board.blankIndex();
        int[] cells = NEIGHBOURS[blank];
        Direction[] directions = TILE_DIRECTIONS[blank];
        List<Successor> successors = new ArrayList<>(cells.length);
        for (int i = 0; i < cells.length; i++) {
            int tile = board.tileAt(cells[i]);
            successors.add(new Successor(board.withBlankSwappedWith(cells[i]), new Move(tile, directions[i])));
        }
        return successors;
    }

    /**
     * Returns the number of legal moves when the blank sits in the provided cell.
     */
    public static int moveCount(int blankIndex) {
        if (blankIndex < 0 || blankIndex >= Board.CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + blankIndex);
        }
        return NEIGHBOURS[blankIndex].length;
    }

    /**
     * A board reachable in one move together with the move that produced it.
     */
    public record Successor(Board board, Move move) {

        public Successor {
            Objects.requireNonNull(board, "board");
            Objects.requireNonNull(move, "move");
        }

        public int cost() {
            return move.cost();
        }
    }
}
