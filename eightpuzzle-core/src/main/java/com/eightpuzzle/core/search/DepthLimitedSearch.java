package com.eightpuzzle.core.search;

import com.eightpuzzle.core.Grid;
import com.eightpuzzle.core.Neighbors;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Explicit-stack depth-first search bounded by a maximum depth.
 *
 * <p>Grids are marked visited when popped rather than when pushed, so the same grid may sit on
 * the stack several times; later copies are discarded once the first one is resolved. The result
 * is a valid path but not necessarily the shortest one.
 */
public final class DepthLimitedSearch implements PathSearcher {

    public static final int DEFAULT_DEPTH_LIMIT = 50;

    private static final Logger LOGGER = Logger.getLogger(DepthLimitedSearch.class.getName());

    private final int depthLimit;

    public DepthLimitedSearch() {
        this(DEFAULT_DEPTH_LIMIT);
    }

    public DepthLimitedSearch(int depthLimit) {
        if (depthLimit < 0) {
            throw new IllegalArgumentException("Depth limit must be non-negative");
        }
        this.depthLimit = depthLimit;
    }

    public int getDepthLimit() {
        return depthLimit;
    }

    @Override
    public SearchResult search(Grid start, Grid goal) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        long searchStart = System.nanoTime();

        Deque<Frame> stack = new ArrayDeque<>();
        Set<Grid> visited = new HashSet<>();
        stack.push(new Frame(start, List.of(), 0));

        long expanded = 0L;
        int peakFrontier = 1;
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (frame.depth() > depthLimit) {
                continue;
            }
            if (!visited.add(frame.grid())) {
                continue;
            }
            if (frame.grid().equals(goal)) {
                return finish(new SearchResult(Strategy.DFS, frame.pathThrough(), expanded, peakFrontier,
                        System.nanoTime() - searchStart));
            }

            expanded++;
            List<Grid> neighbors = Neighbors.of(frame.grid());
            List<Grid> nextPath = frame.pathThrough();
            // reversed so that the first emitted neighbor is popped first
            for (int i = neighbors.size() - 1; i >= 0; i--) {
                Grid neighbor = neighbors.get(i);
                if (!visited.contains(neighbor)) {
                    stack.push(new Frame(neighbor, nextPath, frame.depth() + 1));
                }
            }
            peakFrontier = Math.max(peakFrontier, stack.size());
        }

        return finish(SearchResult.notFound(Strategy.DFS, expanded, peakFrontier, System.nanoTime() - searchStart));
    }

    @Override
    public Strategy strategy() {
        return Strategy.DFS;
    }

    private SearchResult finish(SearchResult result) {
        LOGGER.fine(() -> String.format(
                "DFS finished (limit=%d, found=%s, moves=%d, expanded=%d, peakFrontier=%d, %.2f ms)",
                depthLimit, result.found(), result.moveCount(), result.expandedNodes(), result.peakFrontierSize(),
                result.elapsedMillis()));
        return result;
    }

    /**
     * Stack entry: a grid, the grids leading to it from the start and its depth.
     */
    private record Frame(Grid grid, List<Grid> path, int depth) {

        List<Grid> pathThrough() {
            List<Grid> extended = new ArrayList<>(path.size() + 1);
            extended.addAll(path);
            extended.add(grid);
            return List.copyOf(extended);
        }
    }
}
