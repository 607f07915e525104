package com.eightpuzzle.core.search;

import com.eightpuzzle.core.Grid;

/**
 * Generic interface for state-space searches over sliding-tile grids.
 */
public interface PathSearcher {

    /**
     * Searches for a sequence of slides leading from {@code start} to {@code goal}.
     * Implementations own all their working collections for the duration of the call and keep no
     * state between calls, so a single instance may be shared across threads.
     *
     * @param start the grid to start from, assumed solvable
     * @param goal the grid to reach
     * @return the search result; {@link SearchResult#found()} is {@code false} if the
     *         search space was exhausted without reaching the goal
     */
    SearchResult search(Grid start, Grid goal);

    /**
     * Returns the strategy implemented by this searcher.
     */
    Strategy strategy();
}
