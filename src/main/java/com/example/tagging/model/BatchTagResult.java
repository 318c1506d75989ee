package com.example.tagging.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Results of a batch tagging request, in request order.
 */
public record BatchTagResult(
        String batchId,
        List<ProcessingResult> results,
        BatchTagSummary summary,
        LocalDateTime timestamp
) {

    /**
     * @param averageConfidence mean confidence of the runs that reached confidence scoring
     */
    public record BatchTagSummary(
            int totalEvents,
            int successful,
            int failed,
            int needsHumanReview,
            double totalProcessingTimeMs,
            double averageConfidence
    ) {}
}
