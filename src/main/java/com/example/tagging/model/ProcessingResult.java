package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Result of running one event through the pipeline.
 *
 * @param eventId          id of the processed event
 * @param status           outcome tag
 * @param prediction       scored prediction, null when {@code status.isFailure()}
 * @param errorMessage     failure or parse error message, null on success
 * @param processingTimeMs wall clock time from validation to review decision
 * @param tokensUsed       tokens reported by the model call, 0 if it never ran
 * @param estimatedCost    estimated price of the model call
 * @param model            model that answered, null if the call never ran
 */
public record ProcessingResult(
        String eventId,
        ProcessingStatus status,
        EvaluatedPrediction prediction,
        String errorMessage,
        double processingTimeMs,
        long tokensUsed,
        double estimatedCost,
        String model
) {

    public static ProcessingResult completed(String eventId, EvaluatedPrediction prediction,
                                             double processingTimeMs, long tokensUsed, double estimatedCost,
                                             String model) {
        ProcessingStatus status;
        if (!prediction.valid()) {
            status = ProcessingStatus.INVALID_OUTPUT;
        } else if (prediction.needsHumanReview()) {
            status = ProcessingStatus.HUMAN_REVIEW_REQUIRED;
        } else {
            status = ProcessingStatus.SUCCESS;
        }
        return new ProcessingResult(eventId, status, prediction, prediction.parsed().error(),
                processingTimeMs, tokensUsed, estimatedCost, model);
    }

    public static ProcessingResult failed(String eventId, ProcessingStatus status, String errorMessage,
                                          double processingTimeMs) {
        if (!status.isFailure()) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        return new ProcessingResult(eventId, status, null, errorMessage, processingTimeMs, 0L, 0.0, null);
    }

    @JsonIgnore
    public boolean isFailure() {
        return status.isFailure();
    }

    /** Failed runs always need a human look. */
    public boolean needsHumanReview() {
        return prediction == null || prediction.needsHumanReview();
    }

    public List<String> predictedTags() {
        return prediction != null ? prediction.tags() : List.of();
    }

    public String topTag() {
        List<String> tags = predictedTags();
        return tags.isEmpty() ? null : tags.get(0);
    }
}
