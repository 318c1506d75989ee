package com.example.tagging.model;

/**
 * Outcome tag of a single event run.
 * The first three mean the pipeline ran to the end; the others mean a stage could not run.
 */
public enum ProcessingStatus {
    SUCCESS,
    HUMAN_REVIEW_REQUIRED,
    /** The model answered but the answer could not be used. */
    INVALID_OUTPUT,
    VALIDATION_FAILED,
    UPSTREAM_FAILED,
    /** A stage broke its contract by throwing an unexpected exception. */
    PIPELINE_FAILED;

    public boolean isFailure() {
        return this == VALIDATION_FAILED || this == UPSTREAM_FAILED || this == PIPELINE_FAILED;
    }
}
