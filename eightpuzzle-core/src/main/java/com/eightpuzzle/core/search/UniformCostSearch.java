package com.eightpuzzle.core.search;

import com.eightpuzzle.core.Grid;
import com.eightpuzzle.core.Neighbors;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Priority-queue search ordered by accumulated path cost. Every slide costs {@value #STEP_COST},
 * so the returned path has the same length as the breadth-first one. Equal costs are ordered by
 * {@link Grid#compareTo(Grid)}.
 */
public final class UniformCostSearch implements PathSearcher {

    public static final int STEP_COST = 1;

    private static final Logger LOGGER = Logger.getLogger(UniformCostSearch.class.getName());

    @Override
    public SearchResult search(Grid start, Grid goal) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        long searchStart = System.nanoTime();

        PriorityQueue<Entry> queue = new PriorityQueue<>();
        Map<Grid, Integer> bestCost = new HashMap<>();
        Set<Grid> visited = new HashSet<>();
        Map<Grid, Grid> predecessors = new HashMap<>();
        queue.add(new Entry(0, start));
        bestCost.put(start, 0);
        predecessors.put(start, null);

        long expanded = 0L;
        int peakFrontier = 1;
        while (!queue.isEmpty()) {
            Entry entry = queue.poll();
            Grid current = entry.grid();
            if (visited.contains(current)) {
                continue; // stale
            }
            if (current.equals(goal)) {
                List<Grid> path = PathReconstructor.reconstruct(predecessors, current);
                return finish(new SearchResult(Strategy.UCS, path, expanded, peakFrontier,
                        System.nanoTime() - searchStart));
            }
            visited.add(current);

            expanded++;
            int newCost = entry.cost() + STEP_COST;
            for (Grid neighbor : Neighbors.of(current)) {
                Integer known = bestCost.get(neighbor);
                if (known == null || newCost < known) {
                    bestCost.put(neighbor, newCost);
                    queue.add(new Entry(newCost, neighbor));
                    predecessors.put(neighbor, current);
                }
            }
            peakFrontier = Math.max(peakFrontier, queue.size());
        }

        return finish(SearchResult.notFound(Strategy.UCS, expanded, peakFrontier, System.nanoTime() - searchStart));
    }

    @Override
    public Strategy strategy() {
        return Strategy.UCS;
    }

    private static SearchResult finish(SearchResult result) {
        LOGGER.fine(() -> String.format("UCS finished (found=%s, moves=%d, expanded=%d, peakFrontier=%d, %.2f ms)",
                result.found(), result.moveCount(), result.expandedNodes(), result.peakFrontierSize(),
                result.elapsedMillis()));
        return result;
    }

    private record Entry(int cost, Grid grid) implements Comparable<Entry> {

        @Override
        public int compareTo(Entry other) {
            int byCost = Integer.compare(cost, other.cost);
            return byCost != 0 ? byCost : grid.compareTo(other.grid);
        }
    }
}
