package com.example.tagging.stage;

/**
 * The event is malformed or must not be processed. Never retried.
 */
public class ValidationException extends TaggingException {

    public ValidationException(String message) {
        super(message);
    }
}
