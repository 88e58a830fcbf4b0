package com.expense8.core.search;

import java.util.Objects;

/**
 * Counters collected by one search invocation. Instances are not shared between searches.
 */
public final class SearchStatistics {

    private long nodesPopped;
    private long nodesExpanded;
    private long nodesGenerated;
    private long maxFringeSize;

    public void reset() {
        nodesPopped = 0L;
        nodesExpanded = 0L;
        nodesGenerated = 0L;
        maxFringeSize = 0L;
    }

    public void recordPop() {
        nodesPopped++;
    }

    public void recordExpansion() {
        nodesExpanded++;
    }

    public void recordGenerated() {
        nodesGenerated++;
    }

    /**
     * Records the frontier size observed just before a pop.
     */
    public void observeFringe(int size) {
        if (size > maxFringeSize) {
            maxFringeSize = size;
        }
    }

    /**
     * Adds the counters of another run; the fringe maximum is the larger of the two.
     */
    public void accumulate(SearchStatistics other) {
        Objects.requireNonNull(other, "other");
        nodesPopped += other.nodesPopped;
        nodesExpanded += other.nodesExpanded;
        nodesGenerated += other.nodesGenerated;
        maxFringeSize = Math.max(maxFringeSize, other.maxFringeSize);
    }

    public SearchStatistics copy() {
        SearchStatistics copy = new SearchStatistics();
        copy.accumulate(this);
        return copy;
    }

    public long nodesPopped() {
        return nodesPopped;
    }

    public long nodesExpanded() {
        return nodesExpanded;
    }

    public long nodesGenerated() {
        return nodesGenerated;
    }

    public long maxFringeSize() {
        return maxFringeSize;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SearchStatistics)) {
            return false;
        }
        SearchStatistics that = (SearchStatistics) other;
        return nodesPopped == that.nodesPopped
                && nodesExpanded == that.nodesExpanded
                && nodesGenerated == that.nodesGenerated
                && maxFringeSize == that.maxFringeSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodesPopped, nodesExpanded, nodesGenerated, maxFringeSize);
    }

    @Override
    public String toString() {
        return String.format("popped=%d, expanded=%d, generated=%d, maxFringe=%d",
                nodesPopped, nodesExpanded, nodesGenerated, maxFringeSize);
    }
}
