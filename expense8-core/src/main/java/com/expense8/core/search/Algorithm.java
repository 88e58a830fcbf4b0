package com.expense8.core.search;

import java.util.Locale;
import java.util.Objects;

/**
 * The closed set of strategies understood by {@link GraphSearchEngine}. Each strategy fixes the
 * frontier discipline and the rule deciding when an already seen board is skipped.
 */
public enum Algorithm {
    A_STAR("a*", Discipline.PRIORITY, VisitedRule.CHEAPER_OR_EQUAL_COST, true),
    GREEDY("greedy", Discipline.PRIORITY, VisitedRule.ANY, true),
    UCS("ucs", Discipline.PRIORITY, VisitedRule.CHEAPER_OR_EQUAL_COST, false),
    BFS("bfs", Discipline.FIFO, VisitedRule.ANY, false),
    DFS("dfs", Discipline.LIFO, VisitedRule.ANY, false),
    DLS("dls", Discipline.LIFO, VisitedRule.SHALLOWER_OR_EQUAL_DEPTH, false),
    IDS("ids", Discipline.LIFO, VisitedRule.SHALLOWER_OR_EQUAL_DEPTH, false);

    private final String command;
    private final Discipline discipline;
    private final VisitedRule visitedRule;
    private final boolean usesHeuristic;

    Algorithm(String command, Discipline discipline, VisitedRule visitedRule, boolean usesHeuristic) {
        this.command = command;
        this.discipline = discipline;
        this.visitedRule = visitedRule;
        this.usesHeuristic = usesHeuristic;
    }

    /**
     * Returns the name used on the command line, for example {@code a*}.
     */
    public String command() {
        return command;
    }

    public Discipline discipline() {
        return discipline;
    }

    public VisitedRule visitedRule() {
        return visitedRule;
    }

    public boolean usesHeuristic() {
        return usesHeuristic;
    }

    public boolean isDepthLimited() {
        return this == DLS || this == IDS;
    }

    /**
     * Resolves a command line name, ignoring case. {@code astar} is accepted as an alias of {@code a*}.
     */
    public static Algorithm fromCommand(String name) {
        Objects.requireNonNull(name, "name");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("astar".equals(normalized)) {
            return A_STAR;
        }
        for (Algorithm algorithm : values()) {
            if (algorithm.command.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported method: " + name);
    }

    /**
     * Order in which frontier entries are handed back.
     */
    public enum Discipline {
        PRIORITY,
        FIFO,
        LIFO
    }

    /**
     * Condition under which a board that was expanded before is not expanded again.
     */
    public enum VisitedRule {
        ANY,
        CHEAPER_OR_EQUAL_COST,
        SHALLOWER_OR_EQUAL_DEPTH
    }
}
