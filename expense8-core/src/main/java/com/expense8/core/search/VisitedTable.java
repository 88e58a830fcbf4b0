package com.expense8.core.search;

import com.expense8.core.Board;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Boards already expanded during one search pass, each with the best key it was expanded at.
 * The key is the path cost or the depth, depending on the {@link Algorithm.VisitedRule}; the
 * table keeps the smaller key when a board is expanded again.
 */
public final class VisitedTable {

    private final Algorithm.VisitedRule rule;
    private final Map<Board, Integer> entries = new HashMap<>();

    public VisitedTable(Algorithm.VisitedRule rule) {
        this.rule = Objects.requireNonNull(rule, "rule");
    }

    public Algorithm.VisitedRule getRule() {
        return rule;
    }

    /**
     * Returns {@code true} if reaching {@code board} with {@code key} adds nothing over an earlier
     * expansion.
     */
    public boolean covers(Board board, int key) {
        Integer recorded = entries.get(board);
        if (recorded == null) {
            return false;
        }
        switch (rule) {
            case ANY:
                return true;
            case CHEAPER_OR_EQUAL_COST:
            case SHALLOWER_OR_EQUAL_DEPTH:
                return recorded <= key;
            default:
                throw new IllegalStateException("Unknown visited rule: " + rule);
        }
    }

    public void mark(Board board, int key) {
        Objects.requireNonNull(board, "board");
        entries.merge(board, key, Math::min);
    }

    /**
     * Returns the key recorded for the board, or {@code null} if it was never expanded.
     */
    public Integer get(Board board) {
        return entries.get(board);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
