package com.expense8.core;

/**
 * Reachability test based on the permutation parity of the tiles.
 *
 * <p>On a board of odd width a horizontal move keeps the row-major tile order unchanged and a
 * vertical move shifts one tile past exactly two others, so the number of inversions among tiles
 * 1 to 8 never changes parity. Two boards are mutually reachable exactly when their parities match.
 */
public final class Parity {

    private Parity() {
    }

    /**
     * Returns the number of tile pairs, blank excluded, that appear in the opposite of ascending order.
     */
    public static int inversions(Board board) {
        int[] tiles = board.toArray();
        int inversions = 0;
        for (int i = 0; i < tiles.length; i++) {
            if (tiles[i] == Board.BLANK) {
                continue;
            }
            for (int j = i + 1; j < tiles.length; j++) {
                if (tiles[j] != Board.BLANK && tiles[j] < tiles[i]) {
                    inversions++;
                }
            }
        }
        return inversions;
    }

    public static boolean isEven(Board board) {
        return (inversions(board) & 1) == 0;
    }

    /**
     * Returns {@code true} if {@code goal} can be reached from {@code start} by legal moves.
     */
    public static boolean sameComponent(Board start, Board goal) {
        return isEven(start) == isEven(goal);
    }
}
