package com.eightpuzzle.core;

import java.util.Objects;

/**
 * Inversion-parity test deciding whether a grid can reach {@link Grid#goal()}.
 */
public final class Solvability {

    private Solvability() {
    }

    /**
     * Counts pairs of non-blank tiles, in row-major order, where the earlier tile is larger.
     */
    public static int inversions(Grid grid) {
        Objects.requireNonNull(grid, "grid");
        int[] cells = grid.toArray();
        int inversions = 0;
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == Grid.BLANK) {
                continue;
            }
            for (int j = i + 1; j < cells.length; j++) {
                if (cells[j] != Grid.BLANK && cells[i] > cells[j]) {
                    inversions++;
                }
            }
        }
        return inversions;
    }

    /**
     * Returns {@code true} iff the inversion count is even. A slide never changes the parity,
     * so this holds for every grid reachable from the goal.
     */
    public static boolean isSolvable(Grid grid) {
        return (inversions(grid) & 1) == 0;
    }
}
