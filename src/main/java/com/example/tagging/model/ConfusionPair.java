package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observed top-1 mismatch: the model said {@code predictedTag} where {@code expectedTag} was right.
 */
public record ConfusionPair(String expectedTag, String predictedTag, int count) {

    @JsonProperty("label")
    public String label() {
        return expectedTag + " → " + predictedTag;
    }
}
