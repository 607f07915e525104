package com.eightpuzzle.core.search;

import com.eightpuzzle.core.Grid;
import com.eightpuzzle.core.Neighbors;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Level-order search returning a shortest path in move count. Grids are marked visited when
 * they are discovered, so each grid enters the frontier at most once.
 */
public final class BreadthFirstSearch implements PathSearcher {

    private static final Logger LOGGER = Logger.getLogger(BreadthFirstSearch.class.getName());

    @Override
    public SearchResult search(Grid start, Grid goal) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        long searchStart = System.nanoTime();

        Deque<Grid> frontier = new ArrayDeque<>();
        Set<Grid> visited = new HashSet<>();
        Map<Grid, Grid> predecessors = new HashMap<>();
        frontier.add(start);
        visited.add(start);
        predecessors.put(start, null);

        long expanded = 0L;
        int peakFrontier = 1;
        while (!frontier.isEmpty()) {
            Grid current = frontier.poll();
            if (current.equals(goal)) {
                List<Grid> path = PathReconstructor.reconstruct(predecessors, current);
                return finish(new SearchResult(Strategy.BFS, path, expanded, peakFrontier,
                        System.nanoTime() - searchStart));
            }

            expanded++;
            for (Grid neighbor : Neighbors.of(current)) {
                if (visited.add(neighbor)) {
                    predecessors.put(neighbor, current);
                    frontier.add(neighbor);
                }
            }
            peakFrontier = Math.max(peakFrontier, frontier.size());
        }

        return finish(SearchResult.notFound(Strategy.BFS, expanded, peakFrontier, System.nanoTime() - searchStart));
    }

    @Override
    public Strategy strategy() {
        return Strategy.BFS;
    }

    private static SearchResult finish(SearchResult result) {
        LOGGER.fine(() -> String.format("BFS finished (found=%s, moves=%d, expanded=%d, peakFrontier=%d, %.2f ms)",
                result.found(), result.moveCount(), result.expandedNodes(), result.peakFrontierSize(),
                result.elapsedMillis()));
        return result;
    }
}
