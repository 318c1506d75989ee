package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param dataset dataset file name under the data directory; empty for the test dataset
 */
public record EvaluationRequest(@JsonProperty("dataset") String dataset) {}
