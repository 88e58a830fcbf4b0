package com.expense8.core.search.state;

import com.expense8.core.Board;
import com.expense8.core.Move;
import com.expense8.core.search.Heuristic;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Growable parallel buffers holding the search tree of one pass. Nodes are addressed by integer
 * handles and refer to their parent by handle, so path reconstruction walks indices.
 */
public final class NodeArena {

    public static final int NO_NODE = -1;

    private static final int INITIAL_CAPACITY = 1024;
    private static final int UNKNOWN_HEURISTIC = -1;

    private Board[] boards = new Board[INITIAL_CAPACITY];
    private Move[] moves = new Move[INITIAL_CAPACITY];
    private int[] parents = new int[INITIAL_CAPACITY];
    private int[] costs = new int[INITIAL_CAPACITY];
    private int[] depths = new int[INITIAL_CAPACITY];
    private int[] heuristics = new int[INITIAL_CAPACITY];

    private int size;

    /**
     * Drops every node. Buffers keep their capacity for the next pass.
     */
    public void reset() {
        Arrays.fill(boards, 0, size, null);
        Arrays.fill(moves, 0, size, null);
        size = 0;
    }

    public int addRoot(Board board) {
        return add(Objects.requireNonNull(board, "board"), null, NO_NODE, 0, 0);
    }

    /**
     * Adds a node reached from {@code parent} by {@code move}; cost and depth derive from the parent.
     */
    public int addChild(int parent, Board board, Move move) {
        checkHandle(parent);
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(move, "move");
        return add(board, move, parent, costs[parent] + move.cost(), depths[parent] + 1);
    }

    private int add(Board board, Move move, int parent, int cost, int depth) {
        if (size == boards.length) {
            grow();
        }
        int handle = size++;
        boards[handle] = board;
        moves[handle] = move;
        parents[handle] = parent;
        costs[handle] = cost;
        depths[handle] = depth;
        heuristics[handle] = UNKNOWN_HEURISTIC;
        return handle;
    }

    public int size() {
        return size;
    }

    public Board board(int node) {
        checkHandle(node);
        return boards[node];
    }

    /**
     * Returns the move that produced the node, or {@code null} for a root.
     */
    public Move move(int node) {
        checkHandle(node);
        return moves[node];
    }

    public int parent(int node) {
        checkHandle(node);
        return parents[node];
    }

    public int cost(int node) {
        checkHandle(node);
        return costs[node];
    }

    public int depth(int node) {
        checkHandle(node);
        return depths[node];
    }

    /**
     * Returns the node's heuristic value, computing and caching it on first access.
     */
    public int heuristic(int node, Heuristic heuristic) {
        checkHandle(node);
        int value = heuristics[node];
        if (value == UNKNOWN_HEURISTIC) {
            value = heuristic.estimate(boards[node]);
            heuristics[node] = value;
        }
        return value;
    }

    /**
     * Returns the moves leading from the root to the node.
     */
    public List<Move> pathTo(int node) {
        checkHandle(node);
        List<Move> path = new ArrayList<>(depths[node]);
        for (int current = node; parents[current] != NO_NODE; current = parents[current]) {
            path.add(moves[current]);
        }
        Collections.reverse(path);
        return path;
    }

    private void grow() {
        int capacity = boards.length * 2;
        boards = Arrays.copyOf(boards, capacity);
        moves = Arrays.copyOf(moves, capacity);
        parents = Arrays.copyOf(parents, capacity);
        costs = Arrays.copyOf(costs, capacity);
        depths = Arrays.copyOf(depths, capacity);
        heuristics = Arrays.copyOf(heuristics, capacity);
    }

    private void checkHandle(int node) {
        if (node < 0 || node >= size) {
            throw new IllegalArgumentException("Node handle out of range: " + node);
        }
    }
}
