package com.expense8.core.search.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.expense8.core.Board;
import com.expense8.core.Direction;
import com.expense8.core.Move;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class NodeArenaTest {

    private static final Board START = Board.of(1, 2, 3, 4, 0, 5, 7, 8, 6);

    @Test
    void childrenDeriveCostAndDepthFromParent() {
        NodeArena arena = new NodeArena();
        Move first = new Move(5, Direction.LEFT);
        Move second = new Move(6, Direction.UP);
        Board middle = START.apply(first);

        int root = arena.addRoot(START);
        int child = arena.addChild(root, middle, first);
        int grandchild = arena.addChild(child, middle.apply(second), second);

        assertEquals(NodeArena.NO_NODE, arena.parent(root));
        assertNull(arena.move(root));
        assertEquals(child, arena.parent(grandchild));
        assertEquals(11, arena.cost(grandchild));
        assertEquals(2, arena.depth(grandchild));
        assertEquals(List.of(first, second), arena.pathTo(grandchild));
        assertTrue(arena.pathTo(root).isEmpty());
    }

    @Test
    void growsPastInitialCapacity() {
        NodeArena arena = new NodeArena();
        Move move = new Move(5, Direction.LEFT);
        Board other = START.apply(move);
        int node = arena.addRoot(START);
        for (int i = 0; i < 3000; i++) {
            node = arena.addChild(node, i % 2 == 0 ? other : START, move);
        }

        assertEquals(3001, arena.size());
        assertEquals(3000, arena.depth(node));
        assertEquals(15_000, arena.cost(node));
        assertEquals(3000, arena.pathTo(node).size());
    }

    @Test
    void heuristicIsComputedOnce() {
        NodeArena arena = new NodeArena();
        AtomicInteger calls = new AtomicInteger();
        int root = arena.addRoot(START);

        assertEquals(7, arena.heuristic(root, board -> {
            calls.incrementAndGet();
            return 7;
        }));
        assertEquals(7, arena.heuristic(root, board -> 99));
        assertEquals(1, calls.get());
    }

    @Test
    void resetInvalidatesHandles() {
        NodeArena arena = new NodeArena();
        int root = arena.addRoot(START);
        arena.reset();

        assertEquals(0, arena.size());
        assertThrows(IllegalArgumentException.class, () -> arena.board(root));
        assertThrows(IllegalArgumentException.class,
                () -> arena.addChild(NodeArena.NO_NODE, START, new Move(1, Direction.UP)));
    }
}
