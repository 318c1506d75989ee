package com.example.tagging.stage;

/**
 * The language model could not be reached or returned no usable response.
 */
public class UpstreamException extends TaggingException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
