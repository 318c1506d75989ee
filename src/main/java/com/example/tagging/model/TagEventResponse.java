package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Tagging response body. Confidence and reasoning are left out when the request asked so.
 */
public record TagEventResponse(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("status") ProcessingStatus status,
        @JsonProperty("tag1") String tag1,
        @JsonProperty("tag2") String tag2,
        @JsonProperty("tag3") String tag3,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("processing_time_ms") double processingTimeMs,
        @JsonProperty("tokens_used") long tokensUsed,
        @JsonProperty("cost_dkk") double cost,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("needs_human_review") boolean needsHumanReview,
        @JsonProperty("timestamp") LocalDateTime timestamp
) {

    public static TagEventResponse from(ProcessingResult result, boolean includeReasoning, boolean includeConfidence) {
        List<String> tags = result.predictedTags();
        EvaluatedPrediction prediction = result.prediction();
        return new TagEventResponse(
                result.eventId(),
                result.status(),
                tags.size() > 0 ? tags.get(0) : null,
                tags.size() > 1 ? tags.get(1) : null,
                tags.size() > 2 ? tags.get(2) : null,
                includeConfidence && prediction != null ? prediction.confidence() : null,
                includeReasoning && prediction != null ? prediction.parsed().reasoning() : null,
                result.processingTimeMs(),
                result.tokensUsed(),
                result.estimatedCost(),
                result.errorMessage(),
                result.needsHumanReview(),
                LocalDateTime.now());
    }
}
