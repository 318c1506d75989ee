package com.example.tagging.model;

import java.util.List;

/**
 * Dataset-level rollup of an evaluation run. Recomputed on every run, never stored.
 */
public record AggregateMetrics(
        double accuracyAt1,
        double accuracyAt2,
        double accuracyAt3,
        double weightedAccuracy,
        double exactMatchAt1,
        double exactMatchAt2,
        double exactMatchAt3,
        double precision,
        double recall,
        double f1Score,
        double averageConfidence,
        int totalPredictions,
        int correctPredictions,
        int failedPredictions,
        List<ConfusionPair> mostConfusedTags,
        List<CategoryAccuracy> bestPerformingCategories,
        List<CategoryAccuracy> worstPerformingCategories,
        RunStatistics runStatistics
) {

    public AggregateMetrics {
        mostConfusedTags = List.copyOf(mostConfusedTags);
        bestPerformingCategories = List.copyOf(bestPerformingCategories);
        worstPerformingCategories = List.copyOf(worstPerformingCategories);
    }

    /**
     * Time, cost and token totals over the records of the run.
     *
     * @param modelUsed model reported by the first successful call, null if none ran
     */
    public record RunStatistics(
            double totalProcessingTimeMs,
            double averageProcessingTimeMs,
            double totalCost,
            long totalTokensUsed,
            String modelUsed
    ) {}
}
