package com.eightpuzzle.core;

import com.eightpuzzle.core.search.BreadthFirstSearch;
import com.eightpuzzle.core.search.DepthLimitedSearch;
import com.eightpuzzle.core.search.PathSearcher;
import com.eightpuzzle.core.search.SearchResult;
import com.eightpuzzle.core.search.Strategy;
import com.eightpuzzle.core.search.UniformCostSearch;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Entry point used by front ends: solvability check, shuffling and solving with a named strategy.
 * The solver holds no puzzle state; callers own the current grid and pass it in explicitly.
 */
public final class PuzzleSolver {

    private static final Logger LOGGER = Logger.getLogger(PuzzleSolver.class.getName());

    private final SolverConfig config;
    private final Shuffler shuffler;
    private final Map<Strategy, PathSearcher> searchers = new EnumMap<>(Strategy.class);

    public PuzzleSolver() {
        this(SolverConfig.defaults(), new Shuffler());
    }

    public PuzzleSolver(SolverConfig config) {
        this(config, new Shuffler());
    }

    public PuzzleSolver(SolverConfig config, Shuffler shuffler) {
        this.config = Objects.requireNonNull(config, "config");
        this.shuffler = Objects.requireNonNull(shuffler, "shuffler");
        register(new BreadthFirstSearch());
        register(new DepthLimitedSearch(config.depthLimit()));
        register(new UniformCostSearch());
    }

    public SolverConfig getConfig() {
        return config;
    }

    public boolean isSolvable(Grid grid) {
        return Solvability.isSolvable(grid);
    }

    /**
     * Scrambles the goal grid with the configured number of slides.
     */
    public Grid newPuzzle() {
        return shuffle(Grid.goal(), config.shuffleMoves());
    }

    public Grid shuffle(Grid grid, int moves) {
        return shuffler.shuffle(grid, moves);
    }

    /**
     * Resolves {@code strategyName} and solves with it. Unknown names yield
     * {@link SolveOutcome.Status#UNKNOWN_STRATEGY} without searching.
     */
    public SolveOutcome solve(Grid start, Grid goal, String strategyName) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        Optional<Strategy> strategy = Strategy.fromName(strategyName);
        if (strategy.isEmpty()) {
            LOGGER.info(() -> "Rejected unknown strategy: " + strategyName);
            return SolveOutcome.unknownStrategy(strategyName);
        }
        return solve(start, goal, strategy.get());
    }

    /**
     * Checks solvability of {@code start} and, if it passes, runs the requested strategy.
     */
    public SolveOutcome solve(Grid start, Grid goal, Strategy strategy) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(strategy, "strategy");
        if (!Solvability.isSolvable(start)) {
            LOGGER.info("Rejected unsolvable start grid");
            return SolveOutcome.unsolvable();
        }
        SearchResult result = searchers.get(strategy).search(start, goal);
        return SolveOutcome.fromResult(result);
    }

    private void register(PathSearcher searcher) {
        searchers.put(searcher.strategy(), searcher);
    }
}
