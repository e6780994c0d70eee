package com.driftwatch.exception;

public class BatchSizeExceededException extends DriftWatchException {
    public BatchSizeExceededException(int size, int max) {
        super("BATCH_SIZE_EXCEEDED",
              "Batch of " + size + " rows exceeds the maximum ingestion size of " + max + ".");
    }
}
