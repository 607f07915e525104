package com.eightpuzzle.core;

import com.eightpuzzle.core.search.DepthLimitedSearch;

/**
 * Immutable solver configuration.
 *
 * @param depthLimit maximum depth explored by the depth-limited search
 * @param shuffleMoves number of random slides used to scramble a new puzzle
 */
public record SolverConfig(int depthLimit, int shuffleMoves) {

    public SolverConfig {
        if (depthLimit < 0) {
            throw new IllegalArgumentException("depthLimit must be non-negative");
        }
        if (shuffleMoves < 0) {
            throw new IllegalArgumentException("shuffleMoves must be non-negative");
        }
    }

    public static SolverConfig defaults() {
        return new SolverConfig(DepthLimitedSearch.DEFAULT_DEPTH_LIMIT, Shuffler.NEW_PUZZLE_MOVES);
    }

    public SolverConfig withDepthLimit(int value) {
        return new SolverConfig(value, shuffleMoves);
    }

    public SolverConfig withShuffleMoves(int value) {
        return new SolverConfig(depthLimit, value);
    }
}
