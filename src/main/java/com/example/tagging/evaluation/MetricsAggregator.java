package com.example.tagging.evaluation;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.AggregateMetrics;
import com.example.tagging.model.CategoryAccuracy;
import com.example.tagging.model.ConfusionPair;
import com.example.tagging.model.EvaluationRow;
import com.example.tagging.model.ProcessingResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds evaluation rows into {@link AggregateMetrics}.
 * <p>
 * Rows are visited in dataset order and every tie is broken by first appearance, so the
 * same rows always give the same metrics. Failed rows count in the denominators of the
 * accuracies and of recall, never as correct, and are left out of the average confidence.
 */
public class MetricsAggregator {

    private final double[] weights;
    private final int confusedTopN;
    private final int categoryListSize;

    public MetricsAggregator(TaggingProperties.Evaluation config) {
        List<Double> w = config.accuracyWeights();
        this.weights = new double[]{w.get(0), w.get(1), w.get(2)};
        this.confusedTopN = config.confusedTopN();
        this.categoryListSize = config.categoryListSize();
    }

    public AggregateMetrics aggregate(List<EvaluationRow> rows) {
        int total = rows.size();
        int[] correctAt = new int[4];
        int[] exactAt = new int[4];
        int failed = 0;

        int predictedOccurrences = 0;
        int correctOccurrences = 0;
        int referenceOccurrences = 0;

        int scored = 0;
        double confidenceSum = 0.0;

        Map<ConfusionKey, Integer> confusion = new LinkedHashMap<>();
        Map<String, int[]> categories = new LinkedHashMap<>();

        double totalTimeMs = 0.0;
        double totalCost = 0.0;
        long totalTokens = 0L;
        String model = null;

        for (EvaluationRow row : rows) {
            ProcessingResult result = row.result();
            Set<String> reference = row.groundTruth().tagSet();
            referenceOccurrences += reference.size();

            for (int k = 1; k <= 3; k++) {
                if (row.correctAt(k)) correctAt[k]++;
                if (row.exactMatchAt(k)) exactAt[k]++;
            }

            int[] category = categories.computeIfAbsent(row.groundTruth().primaryTag(), t -> new int[2]);
            category[0]++;
            if (row.correctAt1()) category[1]++;

            totalTimeMs += result.processingTimeMs();
            totalCost += result.estimatedCost();
            totalTokens += result.tokensUsed();
            if (model == null && result.model() != null) {
                model = result.model();
            }

            if (row.failed()) {
                failed++;
                continue;
            }

            Set<String> predicted = new LinkedHashSet<>(result.predictedTags());
            predictedOccurrences += predicted.size();
            for (String tag : predicted) {
                if (reference.contains(tag)) correctOccurrences++;
            }

            if (row.hasConfidence()) {
                scored++;
                confidenceSum += result.prediction().confidence();
            }

            String top = result.topTag();
            if (top != null && !reference.contains(top)) {
                confusion.merge(new ConfusionKey(row.groundTruth().primaryTag(), top), 1, Integer::sum);
            }
        }

        double acc1 = ratio(correctAt[1], total);
        double acc2 = ratio(correctAt[2], total);
        double acc3 = ratio(correctAt[3], total);
        double weighted = Math.min(1.0, weights[0] * acc1 + weights[1] * acc2 + weights[2] * acc3);

        double precision = ratio(correctOccurrences, predictedOccurrences);
        double recall = ratio(correctOccurrences, referenceOccurrences);
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;

        List<CategoryAccuracy> categoryAccuracies = new ArrayList<>();
        categories.forEach((tag, counts) ->
                categoryAccuracies.add(new CategoryAccuracy(tag, counts[0], counts[1], ratio(counts[1], counts[0]))));

        AggregateMetrics.RunStatistics stats = new AggregateMetrics.RunStatistics(
                totalTimeMs, ratio(totalTimeMs, total), totalCost, totalTokens, model);

        return new AggregateMetrics(
                acc1, acc2, acc3, weighted,
                ratio(exactAt[1], total), ratio(exactAt[2], total), ratio(exactAt[3], total),
                precision, recall, f1,
                ratio(confidenceSum, scored),
                total, correctAt[1], failed,
                mostConfused(confusion),
                ranked(categoryAccuracies, Comparator.comparingDouble(CategoryAccuracy::accuracy).reversed()),
                ranked(categoryAccuracies, Comparator.comparingDouble(CategoryAccuracy::accuracy)),
                stats);
    }

    private List<ConfusionPair> mostConfused(Map<ConfusionKey, Integer> confusion) {
        List<ConfusionPair> pairs = new ArrayList<>();
        confusion.forEach((key, count) -> pairs.add(new ConfusionPair(key.expected(), key.predicted(), count)));
        // List.sort is stable: equal counts keep first-encountered order
        pairs.sort(Comparator.comparingInt(ConfusionPair::count).reversed());
        return pairs.subList(0, Math.min(confusedTopN, pairs.size()));
    }

    private List<CategoryAccuracy> ranked(List<CategoryAccuracy> categories, Comparator<CategoryAccuracy> order) {
        List<CategoryAccuracy> sorted = new ArrayList<>(categories);
        sorted.sort(order);
        return sorted.subList(0, Math.min(categoryListSize, sorted.size()));
    }

    private static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }

    private record ConfusionKey(String expected, String predicted) {}
}
