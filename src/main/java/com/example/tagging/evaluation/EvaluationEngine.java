package com.example.tagging.evaluation;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.AggregateMetrics;
import com.example.tagging.model.DatasetEntry;
import com.example.tagging.model.EvaluationReport;
import com.example.tagging.model.EvaluationRow;
import com.example.tagging.model.EventRecord;
import com.example.tagging.model.ProcessingResult;
import com.example.tagging.orchestrator.EventProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the tagging pipeline over a labeled dataset and scores the predictions.
 * A record that fails is kept as a row with its error; the run always covers the whole dataset,
 * because {@link EventProcessor#processAll} turns any per-record exception into a failed result.
 */
@Service
public class EvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(EvaluationEngine.class);

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private final EventProcessor processor;
    private final MetricsAggregator aggregator;

    public EvaluationEngine(EventProcessor processor, TaggingProperties properties) {
        this.processor = processor;
        this.aggregator = new MetricsAggregator(properties.evaluation());
    }

    public EvaluationReport evaluate(List<DatasetEntry> dataset) {
        long start = System.nanoTime();
        String evaluationId = LocalDateTime.now(ZoneOffset.UTC).format(ID_FORMAT)
                + "_" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Evaluation {}: {} records", evaluationId, dataset.size());

        List<EventRecord> events = dataset.stream().map(DatasetEntry::event).toList();
        List<ProcessingResult> results = processor.processAll(events);

        List<EvaluationRow> rows = new ArrayList<>(dataset.size());
        for (int i = 0; i < dataset.size(); i++) {
            rows.add(EvaluationRow.of(i, dataset.get(i), results.get(i)));
        }

        AggregateMetrics metrics = aggregator.aggregate(rows);
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

        log.info("Evaluation {} completed in {}ms: acc@1={}, acc@3={}, f1={}, {} failed",
                evaluationId, String.format("%.0f", elapsedMs),
                String.format("%.3f", metrics.accuracyAt1()), String.format("%.3f", metrics.accuracyAt3()),
                String.format("%.3f", metrics.f1Score()), metrics.failedPredictions());
        return new EvaluationReport(evaluationId, metrics, rows, elapsedMs, LocalDateTime.now());
    }
}
