package com.eightpuzzle.core.search;

import com.eightpuzzle.core.Grid;
import java.util.List;
import java.util.Objects;

/**
 * Result payload returned by {@link PathSearcher} implementations. An empty path means the
 * search space was exhausted without reaching the goal.
 */
public record SearchResult(Strategy strategy, List<Grid> path, long expandedNodes, int peakFrontierSize,
        long elapsedNanos) {

    public SearchResult {
        Objects.requireNonNull(strategy, "strategy");
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static SearchResult notFound(Strategy strategy, long expandedNodes, int peakFrontierSize,
            long elapsedNanos) {
        return new SearchResult(strategy, List.of(), expandedNodes, peakFrontierSize, elapsedNanos);
    }

    public boolean found() {
        return !path.isEmpty();
    }

    /**
     * Returns the number of slides in the path, or {@code -1} when nothing was found.
     */
    public int moveCount() {
        return path.size() - 1;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
