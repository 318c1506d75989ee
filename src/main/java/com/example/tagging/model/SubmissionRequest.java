package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param name    participant name shown on the leaderboard
 * @param dataset dataset file name under the data directory; empty for the test dataset
 */
public record SubmissionRequest(@JsonProperty("name") String name, @JsonProperty("dataset") String dataset) {}
