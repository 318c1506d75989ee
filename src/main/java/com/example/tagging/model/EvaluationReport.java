package com.example.tagging.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Full output of an evaluation run: metrics plus the per-record rows in dataset order.
 */
public record EvaluationReport(
        String evaluationId,
        AggregateMetrics metrics,
        List<EvaluationRow> rows,
        double evaluationTimeMs,
        LocalDateTime timestamp
) {
    public EvaluationReport {
        rows = List.copyOf(rows);
    }
}
