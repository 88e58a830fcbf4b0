package com.expense8.core.search;

import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param algorithm  the strategy to run
 * @param depthLimit the depth limit for {@link Algorithm#DLS}, or {@link #UNBOUNDED}
 * @param maxDepth   the largest limit tried by {@link Algorithm#IDS}
 */
public record SearchConstraints(Algorithm algorithm, int depthLimit, int maxDepth) {

    public static final int UNBOUNDED = -1;

    /**
     * No solvable 3x3 instance needs more than 31 moves.
     */
    public static final int DEFAULT_MAX_DEPTH = 31;

    public SearchConstraints {
        Objects.requireNonNull(algorithm, "algorithm");
        if (depthLimit < UNBOUNDED) {
            throw new IllegalArgumentException("depthLimit must not be negative");
        }
        if (algorithm == Algorithm.DLS && depthLimit == UNBOUNDED) {
            throw new IllegalArgumentException("dls requires a depth limit");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative");
        }
    }

    public static SearchConstraints of(Algorithm algorithm) {
        return new SearchConstraints(algorithm, UNBOUNDED, DEFAULT_MAX_DEPTH);
    }

    public static SearchConstraints depthLimited(int depthLimit) {
        return new SearchConstraints(Algorithm.DLS, depthLimit, DEFAULT_MAX_DEPTH);
    }

    public static SearchConstraints iterativeDeepening(int maxDepth) {
        return new SearchConstraints(Algorithm.IDS, UNBOUNDED, maxDepth);
    }
}
