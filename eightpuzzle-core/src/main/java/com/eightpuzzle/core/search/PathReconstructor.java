package com.eightpuzzle.core.search;

import com.eightpuzzle.core.Grid;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds start-to-goal paths from predecessor maps. Searches record the start grid with a
 * {@code null} predecessor, which terminates the walk.
 */
public final class PathReconstructor {

    private PathReconstructor() {
    }

    /**
     * Walks from {@code terminal} back through {@code predecessors} and returns the visited grids
     * in start-to-terminal order.
     *
     * @throws IllegalStateException if {@code terminal} was never recorded in the map
     */
    public static List<Grid> reconstruct(Map<Grid, Grid> predecessors, Grid terminal) {
        Objects.requireNonNull(predecessors, "predecessors");
        Objects.requireNonNull(terminal, "terminal");
        if (!predecessors.containsKey(terminal)) {
            throw new IllegalStateException("Terminal grid was never discovered:" + System.lineSeparator() + terminal);
        }

        List<Grid> path = new ArrayList<>();
        Grid current = terminal;
        while (current != null) {
            path.add(current);
            if (path.size() > predecessors.size()) {
                throw new IllegalStateException("Predecessor map contains a cycle");
            }
            current = predecessors.get(current);
        }
        Collections.reverse(path);
        return path;
    }
}
