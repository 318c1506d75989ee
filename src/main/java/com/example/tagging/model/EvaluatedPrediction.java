package com.example.tagging.model;

import java.util.List;

/**
 * Parsed prediction after confidence scoring and the review decision.
 */
public record EvaluatedPrediction(
        ParsedTagResult parsed,
        double confidence,
        boolean needsHumanReview
) {

    public List<String> tags() {
        return parsed.tags();
    }

    public boolean valid() {
        return parsed.valid();
    }
}
