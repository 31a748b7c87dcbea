package com.di.schemanova.exception;

/**
 * Raised when a dataset is structurally unusable (e.g. it has no columns at all).
 * Fatal for the offending dataset only; the session keeps processing the others.
 */
public class ShapeException extends RuntimeException {

    private final String datasetName;

    public ShapeException(String datasetName, String message) {
        super(message);
        this.datasetName = datasetName;
    }

    public String getDatasetName() {
        return datasetName;
    }
}
