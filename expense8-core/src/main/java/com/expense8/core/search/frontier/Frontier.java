package com.expense8.core.search.frontier;

/**
 * Container of discovered but unexpanded nodes, identified by their arena handles.
 */
public interface Frontier {

    /**
     * Adds a node. Disciplines that do not order by key ignore it.
     */
    void push(int node, int key);

    /**
     * Removes and returns the next node.
     *
     * @throws java.util.NoSuchElementException if the frontier is empty
     */
    int pop();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the contained nodes in the order successive pops would return them.
     */
    int[] toArray();
}
