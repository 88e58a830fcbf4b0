package com.expense8.core;

/**
 * Direction in which a tile slides into the blank, named from the tile's point of view.
 */
public enum Direction {
    UP(-1, 0, "Up"),
    DOWN(1, 0, "Down"),
    LEFT(0, -1, "Left"),
    RIGHT(0, 1, "Right");

    private final int rowDelta;
    private final int colDelta;
    private final String label;

    Direction(int rowDelta, int colDelta, String label) {
        this.rowDelta = rowDelta;
        this.colDelta = colDelta;
        this.label = label;
    }

    public int rowDelta() {
        return rowDelta;
    }

    public int colDelta() {
        return colDelta;
    }

    public String label() {
        return label;
    }

    public Direction opposite() {
        switch (this) {
            case UP:
                return DOWN;
            case DOWN:
                return UP;
            case LEFT:
                return RIGHT;
            case RIGHT:
                return LEFT;
            default:
                throw new IllegalStateException("Unknown direction: " + this);
        }
    }
}
