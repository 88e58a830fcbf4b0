package com.expense8.core.search;

import com.expense8.core.Board;
import com.expense8.core.MoveGenerator;
import com.expense8.core.search.frontier.FifoFrontier;
import com.expense8.core.search.frontier.Frontier;
import com.expense8.core.search.frontier.LifoFrontier;
import com.expense8.core.search.frontier.PriorityFrontier;
import com.expense8.core.search.state.NodeArena;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Single expansion loop shared by all seven strategies. The {@link Algorithm} selects the frontier
 * discipline, the priority key and the visited rule; depth-limited strategies add a cutoff, and
 * iterative deepening repeats depth-limited passes with growing limits.
 *
 * <p>Per pass the loop samples the frontier size, pops a node, tests it against the goal, skips it
 * if the visited table already covers it, treats it as a leaf at the depth limit, and otherwise
 * marks it visited and pushes the successors the table does not cover. Every generated successor
 * is counted, including the ones that are dropped.
 *
 * <p>Each call owns its arena, frontier, visited table and statistics, so one engine may serve
 * any number of sequential searches.
 */
public final class GraphSearchEngine implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(GraphSearchEngine.class.getName());

    private final Function<Board, Heuristic> heuristicFactory;

    public GraphSearchEngine() {
        this(WeightedManhattanHeuristic::new);
    }

    /**
     * @param heuristicFactory builds the heuristic for a goal; used by A* and greedy only
     */
    public GraphSearchEngine(Function<Board, Heuristic> heuristicFactory) {
        this.heuristicFactory = Objects.requireNonNull(heuristicFactory, "heuristicFactory");
    }

    @Override
    public SearchResult search(Board start, Board goal, SearchConstraints constraints, SearchListener listener) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(constraints, "constraints");
        Objects.requireNonNull(listener, "listener");

        Algorithm algorithm = constraints.algorithm();
        Heuristic heuristic = algorithm.usesHeuristic() ? heuristicFactory.apply(goal) : null;
        SearchRun run = new SearchRun(algorithm, start, goal, heuristic, listener);

        listener.searchStarted(algorithm, start, goal);
        SearchResult result;
        if (algorithm == Algorithm.IDS) {
            result = iterativeDeepening(run, constraints.maxDepth());
        } else {
            int depthLimit = algorithm == Algorithm.DLS ? constraints.depthLimit() : SearchConstraints.UNBOUNDED;
            result = singlePass(run, depthLimit);
        }

        LOGGER.info(() -> String.format("%s finished %s (%s, depth=%d, cost=%d)", algorithm.command(),
                result.outcome(), result.statistics(), result.depth(), result.cost()));
        listener.searchFinished(result);
        return result;
    }

    private SearchResult singlePass(SearchRun run, int depthLimit) {
        Pass pass = run.execute(depthLimit);
        SearchTelemetry telemetry = new SearchTelemetry(List.of(pass.iteration()));
        SearchStatistics statistics = run.statistics.copy();
        if (pass.goalNode() != NodeArena.NO_NODE) {
            return SearchResult.solved(run.algorithm, run.arena.pathTo(pass.goalNode()),
                    run.arena.cost(pass.goalNode()), statistics, telemetry);
        }
        SearchResult.Outcome outcome = pass.iteration().cutoff()
                ? SearchResult.Outcome.DEPTH_EXCEEDED
                : SearchResult.Outcome.EXHAUSTED;
        return SearchResult.failed(run.algorithm, outcome, statistics, telemetry);
    }

    /**
     * Runs passes with limits 0 to {@code maxDepth}. Statistics accumulate across passes. A pass
     * that cuts off nothing has seen every reachable board, which ends the search early.
     */
    private SearchResult iterativeDeepening(SearchRun run, int maxDepth) {
        SearchStatistics total = new SearchStatistics();
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();

        for (int depthLimit = 0; depthLimit <= maxDepth; depthLimit++) {
            Pass pass = run.execute(depthLimit);
            total.accumulate(run.statistics);
            iterations.add(pass.iteration());

            final int limit = depthLimit;
            LOGGER.fine(() -> String.format("ids limit %d: %s, cutoff=%b in %.2f ms", limit, run.statistics,
                    pass.iteration().cutoff(), pass.iteration().elapsedMillis()));

            if (pass.goalNode() != NodeArena.NO_NODE) {
                return SearchResult.solved(run.algorithm, run.arena.pathTo(pass.goalNode()),
                        run.arena.cost(pass.goalNode()), total, new SearchTelemetry(iterations));
            }
            if (!pass.iteration().cutoff()) {
                return SearchResult.failed(run.algorithm, SearchResult.Outcome.EXHAUSTED, total,
                        new SearchTelemetry(iterations));
            }
        }
        return SearchResult.failed(run.algorithm, SearchResult.Outcome.DEPTH_EXCEEDED, total,
                new SearchTelemetry(iterations));
    }

    private static Frontier newFrontier(Algorithm.Discipline discipline) {
        switch (discipline) {
            case PRIORITY:
                return new PriorityFrontier();
            case FIFO:
                return new FifoFrontier();
            case LIFO:
                return new LifoFrontier();
            default:
                throw new IllegalStateException("Unknown discipline: " + discipline);
        }
    }

    private record Pass(int goalNode, SearchTelemetry.Iteration iteration) {
    }

    /**
     * Mutable state of one search call.
     */
    private static final class SearchRun {

        private final Algorithm algorithm;
        private final Board start;
        private final Board goal;
        private final Heuristic heuristic;
        private final SearchListener listener;
        private final boolean tracing;
        private final NodeArena arena = new NodeArena();
        private final VisitedTable visited;
        private final SearchStatistics statistics = new SearchStatistics();
        private Frontier frontier;

        private SearchRun(Algorithm algorithm, Board start, Board goal, Heuristic heuristic,
                SearchListener listener) {
            this.algorithm = algorithm;
            this.start = start;
            this.goal = goal;
            this.heuristic = heuristic;
            this.listener = listener;
            this.tracing = listener != SearchListener.NONE;
            this.visited = new VisitedTable(algorithm.visitedRule());
        }

        private Pass execute(int depthLimit) {
            arena.reset();
            visited.clear();
            statistics.reset();
            frontier = newFrontier(algorithm.discipline());
            long began = System.nanoTime();
            boolean cutoff = false;

            int root = arena.addRoot(start);
            frontier.push(root, priority(root));
            if (tracing) {
                listener.iterationStarted(depthLimit, snapshot(root), statistics.copy());
            }

            while (!frontier.isEmpty()) {
                statistics.observeFringe(frontier.size());
                int node = frontier.pop();
                statistics.recordPop();

                Board board = arena.board(node);
                if (board.equals(goal)) {
                    return new Pass(node, iteration(depthLimit, cutoff, began));
                }
                if (visited.covers(board, visitKey(arena.cost(node), arena.depth(node)))) {
                    continue;
                }
                if (depthLimit != SearchConstraints.UNBOUNDED && arena.depth(node) >= depthLimit) {
                    cutoff = true;
                    continue;
                }

                visited.mark(board, visitKey(arena.cost(node), arena.depth(node)));
                int generated = 0;
                for (MoveGenerator.Successor successor : MoveGenerator.successors(board)) {
                    statistics.recordGenerated();
                    generated++;
                    int childKey = visitKey(arena.cost(node) + successor.cost(), arena.depth(node) + 1);
                    if (visited.covers(successor.board(), childKey)) {
                        continue;
                    }
                    int child = arena.addChild(node, successor.board(), successor.move());
                    frontier.push(child, priority(child));
                }
                statistics.recordExpansion();

                if (tracing) {
                    listener.nodeExpanded(snapshot(node), generated, fringeSnapshot(), visited.size(),
                            statistics.copy());
                }
            }
            return new Pass(NodeArena.NO_NODE, iteration(depthLimit, cutoff, began));
        }

        private int visitKey(int cost, int depth) {
            switch (algorithm.visitedRule()) {
                case CHEAPER_OR_EQUAL_COST:
                    return cost;
                case SHALLOWER_OR_EQUAL_DEPTH:
                    return depth;
                case ANY:
                    return 0;
                default:
                    throw new IllegalStateException("Unknown visited rule: " + algorithm.visitedRule());
            }
        }

        private int priority(int node) {
            switch (algorithm) {
                case A_STAR:
                    return arena.cost(node) + arena.heuristic(node, heuristic);
                case GREEDY:
                    return arena.heuristic(node, heuristic);
                case UCS:
                    return arena.cost(node);
                default:
                    return arena.depth(node);
            }
        }

        private SearchTelemetry.Iteration iteration(int depthLimit, boolean cutoff, long began) {
            return new SearchTelemetry.Iteration(depthLimit, statistics.nodesPopped(), statistics.nodesExpanded(),
                    statistics.nodesGenerated(), statistics.maxFringeSize(), cutoff, System.nanoTime() - began);
        }

        private NodeSnapshot snapshot(int node) {
            int parent = arena.parent(node);
            return new NodeSnapshot(arena.board(node), arena.move(node), arena.cost(node), arena.depth(node),
                    priority(node), parent == NodeArena.NO_NODE ? null : arena.board(parent));
        }

        private List<NodeSnapshot> fringeSnapshot() {
            int[] nodes = frontier.toArray();
            List<NodeSnapshot> snapshots = new ArrayList<>(nodes.length);
            for (int node : nodes) {
                snapshots.add(snapshot(node));
            }
            return snapshots;
        }
    }
}
