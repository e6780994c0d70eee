package com.driftwatch.domain;

import java.util.Optional;

/**
 * Inclusive row-id range. A stored pair of {@code (0, 0)} means "unset".
 */
public record WindowRange(long startRow, long endRow) {

    public WindowRange {
        if (startRow < 1 || endRow < startRow) {
            throw new IllegalArgumentException(
                "Invalid window range [" + startRow + ", " + endRow + "]");
        }
    }

    public static Optional<WindowRange> fromStored(long startRow, long endRow) {
        if (startRow <= 0 || endRow <= 0 || endRow < startRow) {
            return Optional.empty();
        }
        return Optional.of(new WindowRange(startRow, endRow));
    }

    public long length() {
        return endRow - startRow + 1;
    }

    public boolean contains(long rowId) {
        return rowId >= startRow && rowId <= endRow;
    }

    @Override
    public String toString() {
        return "rows " + startRow + " to " + endRow;
    }
}
