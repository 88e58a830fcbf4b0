package com.expense8.core.search.frontier;

import java.util.Comparator;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Smallest key first. Entries with equal keys leave in insertion order.
 */
public final class PriorityFrontier implements Frontier {

    private static final Comparator<Entry> ORDER = Comparator.comparingInt(Entry::key)
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private long nextSequence;

    @Override
    public void push(int node, int key) {
        queue.add(new Entry(node, key, nextSequence++));
    }

    @Override
    public int pop() {
        Entry entry = queue.poll();
        if (entry == null) {
            throw new NoSuchElementException("Frontier is empty");
        }
        return entry.node();
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int[] toArray() {
        return queue.stream().sorted(ORDER).mapToInt(Entry::node).toArray();
    }

    private record Entry(int node, int key, long sequence) {
    }
}
