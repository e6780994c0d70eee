package com.driftwatch.exception;

public class WindowShapeMismatchException extends DriftWatchException {
    public WindowShapeMismatchException(String column) {
        super("WINDOW_SHAPE_MISMATCH",
              "Numeric baseline column '" + column + "' is absent from every current row.");
    }
}
