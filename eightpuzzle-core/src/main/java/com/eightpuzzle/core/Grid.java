package com.eightpuzzle.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 3x3 arrangement of the tiles 0-8, where 0 denotes the blank.
 * Cells are stored in row-major order. Two grids are equal iff all nine cells match
 * positionally, so instances can be used as hash keys during a search.
 */
public final class Grid implements Comparable<Grid> {

    public static final int SIZE = 3;
    public static final int CELL_COUNT = SIZE * SIZE;
    public static final int BLANK = 0;

    private static final Grid GOAL = new Grid(new int[]{1, 2, 3, 4, 5, 6, 7, 8, 0});

    private final int[] cells;
    private final int blankIndex;
    private final int hash;

    private Grid(int[] cells) {
        this.cells = cells;
        this.blankIndex = indexOf(cells, BLANK);
        this.hash = Arrays.hashCode(cells);
    }

    /**
     * Returns the fixed goal configuration {@code (1,2,3),(4,5,6),(7,8,0)}.
     */
    public static Grid goal() {
        return GOAL;
    }

    /**
     * Creates a grid from nine row-major cell values.
     */
    public static Grid of(int... cells) {
        Objects.requireNonNull(cells, "cells");
        int[] copy = cells.clone();
        validate(copy);
        return new Grid(copy);
    }

    /**
     * Creates a grid from three rows of three values each.
     */
    public static Grid of(int[][] rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " rows but got " + rows.length);
        }
        int[] flat = new int[CELL_COUNT];
        for (int row = 0; row < SIZE; row++) {
            int[] values = Objects.requireNonNull(rows[row], "rows[" + row + "]");
            if (values.length != SIZE) {
                throw new IllegalArgumentException("Row " + row + " has " + values.length + " cells instead of " + SIZE);
            }
            System.arraycopy(values, 0, flat, row * SIZE, SIZE);
        }
        validate(flat);
        return new Grid(flat);
    }

    /**
     * Parses nine digits, optionally separated by whitespace or commas, e.g. {@code "1 2 3 4 5 6 7 0 8"}
     * or {@code "123456708"}.
     */
    public static Grid parse(String text) {
        Objects.requireNonNull(text, "text");
        String digits = text.replaceAll("[\\s,\\[\\]]", "");
        if (digits.length() != CELL_COUNT) {
            throw new IllegalArgumentException("Expected " + CELL_COUNT + " digits but got '" + text + "'");
        }
        int[] flat = new int[CELL_COUNT];
        for (int i = 0; i < CELL_COUNT; i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '8') {
                throw new IllegalArgumentException("Invalid tile '" + c + "' in '" + text + "'");
            }
            flat[i] = c - '0';
        }
        validate(flat);
        return new Grid(flat);
    }

    /**
     * Returns the tile value at the given cell.
     */
    public int tileAt(int row, int column) {
        checkCoordinate(row, "row");
        checkCoordinate(column, "column");
        return cells[row * SIZE + column];
    }

    /**
     * Returns the position of the blank tile.
     */
    public Position blankPosition() {
        return new Position(blankIndex / SIZE, blankIndex % SIZE);
    }

    /**
     * Returns {@code true} if this grid equals {@link #goal()}.
     */
    public boolean isGoal() {
        return equals(GOAL);
    }

    /**
     * Returns {@code true} if the blank can slide in the given direction without leaving the board.
     */
    public boolean canSlide(Direction direction) {
        Objects.requireNonNull(direction, "direction");
        int row = blankIndex / SIZE + direction.rowDelta();
        int column = blankIndex % SIZE + direction.columnDelta();
        return row >= 0 && row < SIZE && column >= 0 && column < SIZE;
    }

    /**
     * Returns a new grid with the blank swapped with its neighbor in the given direction.
     */
    public Grid slide(Direction direction) {
        if (!canSlide(direction)) {
            throw new IllegalArgumentException("Blank at " + blankPosition() + " cannot move " + direction);
        }
        int target = blankIndex + direction.rowDelta() * SIZE + direction.columnDelta();
        int[] updated = cells.clone();
        updated[blankIndex] = updated[target];
        updated[target] = BLANK;
        return new Grid(updated);
    }

    /**
     * Returns a copy of the cells in row-major order.
     */
    public int[] toArray() {
        return cells.clone();
    }

    /**
     * Returns a copy of the grid as three rows.
     */
    public int[][] toRows() {
        int[][] rows = new int[SIZE][];
        for (int row = 0; row < SIZE; row++) {
            rows[row] = Arrays.copyOfRange(cells, row * SIZE, (row + 1) * SIZE);
        }
        return rows;
    }

    @Override
    public int compareTo(Grid other) {
        return Arrays.compare(cells, other.cells);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Grid)) {
            return false;
        }
        Grid other = (Grid) obj;
        return hash == other.hash && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int[] row : toRows()) {
            if (builder.length() > 0) {
                builder.append(System.lineSeparator());
            }
            builder.append(Arrays.toString(row));
        }
        return builder.toString();
    }

    private static void validate(int[] cells) {
        if (cells.length != CELL_COUNT) {
            throw new IllegalArgumentException("Expected " + CELL_COUNT + " cells but got " + cells.length);
        }
        boolean[] seen = new boolean[CELL_COUNT];
        for (int value : cells) {
            if (value < 0 || value >= CELL_COUNT) {
                throw new IllegalArgumentException("Tile value out of range: " + value);
            }
            if (seen[value]) {
                throw new IllegalArgumentException("Tile " + value + " appears more than once");
            }
            seen[value] = true;
        }
    }

    private static int indexOf(int[] cells, int value) {
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == value) {
                return i;
            }
        }
        throw new IllegalStateException("Grid has no tile " + value);
    }

    private static void checkCoordinate(int value, String name) {
        if (value < 0 || value >= SIZE) {
            throw new IllegalArgumentException(name + " out of range: " + value);
        }
    }
}
