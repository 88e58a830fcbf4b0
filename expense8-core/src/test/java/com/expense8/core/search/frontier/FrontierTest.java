package com.expense8.core.search.frontier;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class FrontierTest {

    @Test
    void fifoPopsInInsertionOrder() {
        Frontier frontier = new FifoFrontier();
        push(frontier, 1, 2, 3);

        assertArrayEquals(new int[] {1, 2, 3}, frontier.toArray());
        assertEquals(1, frontier.pop());
        assertEquals(2, frontier.size());
    }

    @Test
    void lifoPopsInReverseOrder() {
        Frontier frontier = new LifoFrontier();
        push(frontier, 1, 2, 3);

        assertArrayEquals(new int[] {3, 2, 1}, frontier.toArray());
        assertEquals(3, frontier.pop());
        assertEquals(2, frontier.pop());
    }

    @Test
    void priorityBreaksTiesByInsertion() {
        Frontier frontier = new PriorityFrontier();
        frontier.push(10, 5);
        frontier.push(11, 3);
        frontier.push(12, 5);
        frontier.push(13, 3);

        assertArrayEquals(new int[] {11, 13, 10, 12}, frontier.toArray());
        assertEquals(11, frontier.pop());
        assertEquals(13, frontier.pop());
        assertEquals(10, frontier.pop());
        assertEquals(12, frontier.pop());
        assertTrue(frontier.isEmpty());
    }

    @Test
    void popOnEmptyThrows() {
        assertThrows(NoSuchElementException.class, () -> new FifoFrontier().pop());
        assertThrows(NoSuchElementException.class, () -> new LifoFrontier().pop());
        assertThrows(NoSuchElementException.class, () -> new PriorityFrontier().pop());
    }

    private static void push(Frontier frontier, int... nodes) {
        for (int node : nodes) {
            frontier.push(node, 0);
        }
    }
}
