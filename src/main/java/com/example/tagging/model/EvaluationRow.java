package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One evaluated dataset record: the pipeline result next to its reference tags.
 *
 * @param index         position of the record in the dataset
 * @param eventId       event id
 * @param title         event title
 * @param result        pipeline result
 * @param groundTruth   reference tags
 * @param matchPosition 1-based position of the first predicted tag found in the reference set, null if none
 * @param errorMessage  set when the pipeline failed for this record
 */
public record EvaluationRow(
        int index,
        String eventId,
        String title,
        ProcessingResult result,
        GroundTruthRecord groundTruth,
        Integer matchPosition,
        String errorMessage
) {

    public static EvaluationRow of(int index, DatasetEntry entry, ProcessingResult result) {
        Integer position = null;
        if (!result.isFailure()) {
            Set<String> reference = entry.groundTruth().tagSet();
            List<String> predicted = result.predictedTags();
            for (int i = 0; i < predicted.size(); i++) {
                if (reference.contains(predicted.get(i))) {
                    position = i + 1;
                    break;
                }
            }
        }
        return new EvaluationRow(index, result.eventId(), entry.event().title(), result,
                entry.groundTruth(), position, result.isFailure() ? result.errorMessage() : null);
    }

    @JsonIgnore
    public boolean failed() {
        return result.isFailure();
    }

    /** Any reference tag among the first {@code k} predictions. */
    public boolean correctAt(int k) {
        return matchPosition != null && matchPosition <= k;
    }

    @JsonProperty("correctAt1")
    public boolean correctAt1() {
        return correctAt(1);
    }

    @JsonProperty("correctAt2")
    public boolean correctAt2() {
        return correctAt(2);
    }

    @JsonProperty("correctAt3")
    public boolean correctAt3() {
        return correctAt(3);
    }

    /** The first {@code k} predictions, as a set, equal the reference set. */
    public boolean exactMatchAt(int k) {
        if (failed()) {
            return false;
        }
        List<String> predicted = result.predictedTags();
        Set<String> topK = new LinkedHashSet<>(predicted.subList(0, Math.min(k, predicted.size())));
        return topK.equals(groundTruth.tagSet());
    }

    /** Whether the run reached confidence scoring. */
    public boolean hasConfidence() {
        return result.prediction() != null;
    }
}
