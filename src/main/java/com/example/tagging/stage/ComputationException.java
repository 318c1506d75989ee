package com.example.tagging.stage;

/**
 * A pure stage received input outside its contract. Indicates a programming error.
 */
public class ComputationException extends TaggingException {

    public ComputationException(String message) {
        super(message);
    }
}
