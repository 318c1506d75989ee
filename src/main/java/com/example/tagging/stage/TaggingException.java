package com.example.tagging.stage;

/**
 * Base of the failures that stop a pipeline stage from running.
 * Unusable model output is not one of them: it is reported as data by the {@link OutputParser}.
 */
public abstract class TaggingException extends RuntimeException {

    protected TaggingException(String message) {
        super(message);
    }

    protected TaggingException(String message, Throwable cause) {
        super(message, cause);
    }
}
