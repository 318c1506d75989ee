package com.example.tagging.service;

/**
 * The leaderboard rejected a submission or could not be reached.
 */
public class SubmissionException extends RuntimeException {

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
