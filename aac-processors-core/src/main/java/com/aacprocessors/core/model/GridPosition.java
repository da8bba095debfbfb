package com.aacprocessors.core.model;

import java.util.Comparator;

/**
 * Zero-based cell coordinates on a page grid.
 *
 * @param row row index
 * @param column column index
 */
public record GridPosition(int row, int column) implements Comparable<GridPosition> {

    private static final Comparator<GridPosition> ROW_MAJOR =
        Comparator.comparingInt(GridPosition::row).thenComparingInt(GridPosition::column);

    /**
     * Compact constructor with validation.
     */
    public GridPosition {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Grid position must not be negative: " + row + "," + column);
        }
    }

    /**
     * Converts a row-major cell index into a position.
     *
     * @param index cell index ({@code row * columns + column})
     * @param columns number of columns in the grid
     * @return position of the cell
     */
    public static GridPosition fromIndex(int index, int columns) {
        return new GridPosition(index / columns, index % columns);
    }

    /**
     * Returns the row-major cell index of this position.
     *
     * @param columns number of columns in the grid
     * @return {@code row * columns + column}
     */
    public int toIndex(int columns) {
        return row * columns + column;
    }

    @Override
    public int compareTo(GridPosition other) {
        return ROW_MAJOR.compare(this, other);
    }

    @Override
    public String toString() {
        return row + "," + column;
    }
}
