package com.expense8.core;

import java.util.Objects;

/**
 * A single tile sliding into the adjacent blank.
 *
 * @param tile      the number on the tile that moved, between 1 and 8
 * @param direction the direction the tile travelled
 */
public record Move(int tile, Direction direction) {

    public Move {
        Objects.requireNonNull(direction, "direction");
        if (tile < 1 || tile >= Board.CELL_COUNT) {
            throw new IllegalArgumentException("Tile out of range: " + tile);
        }
    }

    /**
     * Returns the cost of the move, which equals the number on the moved tile.
     */
    public int cost() {
        return tile;
    }

    /**
     * Returns the human readable label, for example {@code Move 5 Up}.
     */
    public String label() {
        return "Move " + tile + " " + direction.label();
    }

    @Override
    public String toString() {
        return label();
    }
}
