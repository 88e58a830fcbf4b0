package com.expense8.core.search.frontier;

import java.util.ArrayDeque;

/**
 * Last in, first out. Successors pushed in generation order come back in reverse.
 */
public final class LifoFrontier implements Frontier {

    private final ArrayDeque<Integer> stack = new ArrayDeque<>();

    @Override
    public void push(int node, int key) {
        stack.push(node);
    }

    @Override
    public int pop() {
        return stack.pop();
    }

    @Override
    public int size() {
        return stack.size();
    }

    @Override
    public int[] toArray() {
        return stack.stream().mapToInt(Integer::intValue).toArray();
    }
}
