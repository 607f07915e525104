package com.eightpuzzle.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Utility generating every grid reachable from a given grid by one slide of the blank.
 */
public final class Neighbors {

    private static final Direction[] DIRECTIONS = Direction.values();

    private Neighbors() {
    }

    /**
     * Returns the neighbors of {@code grid} in the order up, down, left, right, skipping
     * directions that leave the board. Corners yield two grids, edges three and the center four.
     */
    public static List<Grid> of(Grid grid) {
        Objects.requireNonNull(grid, "grid");
        List<Grid> neighbors = new ArrayList<>(DIRECTIONS.length);
        for (Direction direction : DIRECTIONS) {
            if (grid.canSlide(direction)) {
                neighbors.add(grid.slide(direction));
            }
        }
        return Collections.unmodifiableList(neighbors);
    }

    /**
     * Returns {@code true} if {@code b} is one slide away from {@code a}.
     */
    public static boolean areAdjacent(Grid a, Grid b) {
        return of(a).contains(b);
    }
}
