package com.expense8.core.search;

import com.expense8.core.Board;
import java.util.List;

/**
 * Receives the event stream of a search run. All methods default to doing nothing.
 *
 * <p>Snapshots passed to a listener are built only when a listener other than {@link #NONE} is
 * attached, so tracing costs nothing otherwise.
 */
public interface SearchListener {

    SearchListener NONE = new SearchListener() {
    };

    default void searchStarted(Algorithm algorithm, Board start, Board goal) {
    }

    /**
     * Called once per pass with the freshly initialized frontier holding only the root.
     *
     * @param depthLimit the limit of the pass, or {@link SearchConstraints#UNBOUNDED}
     */
    default void iterationStarted(int depthLimit, NodeSnapshot root, SearchStatistics statistics) {
    }

    /**
     * Called after a node was expanded and its successors were pushed.
     *
     * @param successors  the number of successors generated
     * @param fringe      the frontier contents in the order they would be popped
     * @param closedCount the number of boards in the visited table
     */
    default void nodeExpanded(NodeSnapshot node, int successors, List<NodeSnapshot> fringe, int closedCount,
            SearchStatistics statistics) {
    }

    default void searchFinished(SearchResult result) {
    }
}
