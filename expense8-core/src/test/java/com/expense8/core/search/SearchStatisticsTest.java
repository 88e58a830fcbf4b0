package com.expense8.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

import org.junit.jupiter.api.Test;

class SearchStatisticsTest {

    @Test
    void fringeKeepsMaximum() {
        SearchStatistics statistics = new SearchStatistics();
        statistics.observeFringe(3);
        statistics.observeFringe(7);
        statistics.observeFringe(2);

        assertEquals(7L, statistics.maxFringeSize());
    }

    @Test
    void accumulateSumsCountersAndKeepsLargestFringe() {
        SearchStatistics first = sample(3, 2, 7, 5);
        SearchStatistics second = sample(4, 1, 4, 4);

        first.accumulate(second);

        assertEquals(7L, first.nodesPopped());
        assertEquals(3L, first.nodesExpanded());
        assertEquals(11L, first.nodesGenerated());
        assertEquals(5L, first.maxFringeSize());
    }

    @Test
    void copyIsIndependent() {
        SearchStatistics original = sample(1, 1, 1, 1);
        SearchStatistics copy = original.copy();

        assertNotSame(original, copy);
        assertEquals(original, copy);
        original.recordPop();
        assertEquals(1L, copy.nodesPopped());
    }

    @Test
    void resetClearsCounters() {
        SearchStatistics statistics = sample(2, 2, 2, 2);
        statistics.reset();

        assertEquals(new SearchStatistics(), statistics);
        assertEquals("popped=0, expanded=0, generated=0, maxFringe=0", statistics.toString());
    }

    private static SearchStatistics sample(int popped, int expanded, int generated, int fringe) {
        SearchStatistics statistics = new SearchStatistics();
        for (int i = 0; i < popped; i++) {
            statistics.recordPop();
        }
        for (int i = 0; i < expanded; i++) {
            statistics.recordExpansion();
        }
        for (int i = 0; i < generated; i++) {
            statistics.recordGenerated();
        }
        statistics.observeFringe(fringe);
        return statistics;
    }
}
