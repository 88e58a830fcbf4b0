package com.expense8.core;

import java.util.StringJoiner;

/**
 * Immutable packed representation of a 3x3 sliding puzzle.
 * Each of the nine cells occupies four bits of a long value, cell 0 in the lowest nibble.
 * Cells are numbered row-major, so {@code index = row * 3 + col}. The value 0 marks the blank.
 */
public final class Board {

    public static final int SIZE = 3;
    public static final int CELL_COUNT = SIZE * SIZE;
    public static final int BLANK = 0;

    private static final int BITS_PER_CELL = 4;
    private static final long CELL_MASK = 0xFL;

    private final long cells;
    private final int blankIndex;

    private Board(long cells, int blankIndex) {
        this.cells = cells;
        this.blankIndex = blankIndex;
    }

    /**
     * Creates a board from nine row-major values. Each value between 0 and 8 must appear exactly once.
     */
    public static Board of(int... tiles) {
        if (tiles == null || tiles.length != CELL_COUNT) {
            throw new IllegalArgumentException("Board requires exactly " + CELL_COUNT + " values");
        }
        boolean[] seen = new boolean[CELL_COUNT];
        long packed = 0L;
        int blank = -1;
        for (int index = 0; index < CELL_COUNT; index++) {
            int tile = tiles[index];
            if (tile < 0 || tile >= CELL_COUNT) {
                throw new IllegalArgumentException("Tile value out of range: " + tile);
            }
            if (seen[tile]) {
                throw new IllegalArgumentException("Duplicate tile value: " + tile);
            }
            seen[tile] = true;
            packed |= (long) tile << (index * BITS_PER_CELL);
            if (tile == BLANK) {
                blank = index;
            }
        }
        return new Board(packed, blank);
    }

    /**
     * Returns the value stored in the provided cell.
     */
    public int tileAt(int index) {
        checkIndex(index);
        return (int) ((cells >>> (index * BITS_PER_CELL)) & CELL_MASK);
    }

    /**
     * Returns the cell index currently holding the provided tile.
     */
    public int indexOf(int tile) {
        if (tile < 0 || tile >= CELL_COUNT) {
            throw new IllegalArgumentException("Tile value out of range: " + tile);
        }
        for (int index = 0; index < CELL_COUNT; index++) {
            if (tileAt(index) == tile) {
                return index;
            }
        }
        throw new IllegalStateException("Tile " + tile + " missing from " + this);
    }

    public int blankIndex() {
        return blankIndex;
    }

    /**
     * Returns a new board with the blank exchanged for the tile in the provided neighbouring cell.
     * Adjacency is the caller's responsibility.
     */
    Board withBlankSwappedWith(int index) {
        checkIndex(index);
        long tile = (cells >>> (index * BITS_PER_CELL)) & CELL_MASK;
        long cleared = cells & ~(CELL_MASK << (index * BITS_PER_CELL));
        long updated = cleared | (tile << (blankIndex * BITS_PER_CELL));
        return new Board(updated, index);
    }

    /**
     * Replays the provided move and returns the resulting board.
     *
     * @throws IllegalArgumentException if the tile is not next to the blank in the move's direction
     */
    public Board apply(Move move) {
        int from = indexOf(move.tile());
        int row = row(from) + move.direction().rowDelta();
        int col = col(from) + move.direction().colDelta();
        if (row < 0 || row >= SIZE || col < 0 || col >= SIZE || index(row, col) != blankIndex) {
            throw new IllegalArgumentException("Illegal move " + move.label() + " on " + this);
        }
        return withBlankSwappedWith(from);
    }

    /**
     * Returns the board as a row-major array of nine values.
     */
    public int[] toArray() {
        int[] tiles = new int[CELL_COUNT];
        for (int index = 0; index < CELL_COUNT; index++) {
            tiles[index] = tileAt(index);
        }
        return tiles;
    }

    /**
     * Returns the board rendered as nested rows, for example {@code [[1, 2, 3], [4, 0, 5], [7, 8, 6]]}.
     */
    public String toGridString() {
        StringJoiner rows = new StringJoiner(", ", "[", "]");
        for (int row = 0; row < SIZE; row++) {
            StringJoiner cols = new StringJoiner(", ", "[", "]");
            for (int col = 0; col < SIZE; col++) {
                cols.add(Integer.toString(tileAt(index(row, col))));
            }
            rows.add(cols.toString());
        }
        return rows.toString();
    }

    public static int row(int index) {
        return index / SIZE;
    }

    public static int col(int index) {
        return index % SIZE;
    }

    public static int index(int row, int col) {
        return row * SIZE + col;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        return cells == ((Board) other).cells;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(cells);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (int index = 0; index < CELL_COUNT; index++) {
            joiner.add(Integer.toString(tileAt(index)));
        }
        return joiner.toString();
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
    }
}
