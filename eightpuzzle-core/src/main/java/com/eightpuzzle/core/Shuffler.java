package com.eightpuzzle.core;

import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Produces scrambled grids by applying random legal slides. Starting from a solvable grid the
 * result is always solvable, since every slide preserves inversion parity.
 */
public final class Shuffler {

    public static final int DEFAULT_MOVES = 20;
    public static final int NEW_PUZZLE_MOVES = 30;

    private final Random random;

    /**
     * Creates a shuffler backed by {@link ThreadLocalRandom}.
     */
    public Shuffler() {
        this.random = null;
    }

    /**
     * Creates a shuffler drawing from the provided source, e.g. a seeded {@link Random} in tests.
     */
    public Shuffler(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Applies {@link #DEFAULT_MOVES} random slides to {@code grid}.
     */
    public Grid shuffle(Grid grid) {
        return shuffle(grid, DEFAULT_MOVES);
    }

    /**
     * Replaces {@code grid} with a uniformly chosen neighbor {@code moves} times.
     */
    public Grid shuffle(Grid grid, int moves) {
        Objects.requireNonNull(grid, "grid");
        if (moves < 0) {
            throw new IllegalArgumentException("moves must be non-negative");
        }
        Random source = random != null ? random : ThreadLocalRandom.current();
        Grid current = grid;
        for (int i = 0; i < moves; i++) {
            List<Grid> neighbors = Neighbors.of(current);
            current = neighbors.get(source.nextInt(neighbors.size()));
        }
        return current;
    }
}
