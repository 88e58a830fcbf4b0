package com.expense8.core.search.frontier;

import java.util.ArrayDeque;

/**
 * First in, first out.
 */
public final class FifoFrontier implements Frontier {

    private final ArrayDeque<Integer> queue = new ArrayDeque<>();

    @Override
    public void push(int node, int key) {
        queue.addLast(node);
    }

    @Override
    public int pop() {
        return queue.removeFirst();
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int[] toArray() {
        return queue.stream().mapToInt(Integer::intValue).toArray();
    }
}
