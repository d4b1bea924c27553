package com.llmorchestrator.error;

public class DimensionMismatchException extends IllegalArgumentException {

    public DimensionMismatchException(int left, int right) {
        super("Vectors must have the same dimensions, got " + left + " and " + right);
    }
}
