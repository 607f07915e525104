package com.eightpuzzle.core;

/**
 * Zero-based cell coordinate on the 3x3 grid.
 */
public record Position(int row, int column) {

    public Position {
        if (row < 0 || row >= Grid.SIZE) {
            throw new IllegalArgumentException("row out of range: " + row);
        }
        if (column < 0 || column >= Grid.SIZE) {
            throw new IllegalArgumentException("column out of range: " + column);
        }
    }
}
