package com.example.tagging.service;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.evaluation.EvaluationEngine;
import com.example.tagging.model.AggregateMetrics;
import com.example.tagging.model.EvaluationReport;
import com.example.tagging.model.EvaluationRow;
import com.example.tagging.model.ProcessingResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Evaluates the test dataset and posts the predictions and metrics to the leaderboard.
 * The leaderboard's answer is handed back as received.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final RestClient restClient;
    private final String submitPath;
    private final DatasetLoader datasetLoader;
    private final EvaluationEngine evaluationEngine;
    private final ObjectMapper objectMapper;

    @Autowired
    public SubmissionService(TaggingProperties properties,
                             RestClient.Builder restClientBuilder,
                             DatasetLoader datasetLoader,
                             EvaluationEngine evaluationEngine,
                             ObjectMapper objectMapper) {
        this(dashboardClient(properties, restClientBuilder), properties.dashboard().submitPath(),
                datasetLoader, evaluationEngine, objectMapper);
    }

    SubmissionService(RestClient restClient, String submitPath, DatasetLoader datasetLoader,
                      EvaluationEngine evaluationEngine, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.submitPath = submitPath;
        this.datasetLoader = datasetLoader;
        this.evaluationEngine = evaluationEngine;
        this.objectMapper = objectMapper;
    }

    private static RestClient dashboardClient(TaggingProperties properties, RestClient.Builder builder) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(10));
        factory.setReadTimeout(Duration.ofSeconds(60));
        return builder
                .baseUrl(properties.dashboard().baseUrl())
                .requestFactory(factory)
                .build();
    }

    /**
     * @param participantName name shown on the leaderboard
     * @param datasetName     dataset to evaluate, null for the configured test dataset
     * @return the leaderboard response body, unmodified
     * @throws IllegalArgumentException if the name is blank
     * @throws DatasetException         if the dataset cannot be loaded
     * @throws SubmissionException      if the leaderboard call fails
     */
    public String submit(String participantName, String datasetName) {
        if (participantName == null || participantName.isBlank()) {
            throw new IllegalArgumentException("Participant name is required");
        }
        String name = participantName.strip();
        log.info("Submitting evaluation for participant '{}'", name);

        EvaluationReport report = evaluationEngine.evaluate(datasetLoader.load(datasetName));
        ObjectNode payload = buildPayload(name, report);

        try {
            String response = restClient.post()
                    .uri(submitPath)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(payload))
                    .retrieve()
                    .body(String.class);
            log.info("Submission for '{}' accepted (evaluation {})", name, report.evaluationId());
            return response;
        } catch (RestClientException e) {
            throw new SubmissionException("Leaderboard submission failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize submission payload", e);
        }
    }

    ObjectNode buildPayload(String name, EvaluationReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", name);
        root.put("evaluation_id", report.evaluationId());
        root.put("submitted_at", Instant.now().toString());

        ArrayNode predictions = root.putArray("predictions");
        for (EvaluationRow row : report.rows()) {
            ProcessingResult result = row.result();
            List<String> tags = result.predictedTags();
            ObjectNode p = predictions.addObject();
            p.put("arrangement_id", row.eventId());
            p.put("arrangement_title", row.title());
            p.put("predicted_tag1", tags.size() > 0 ? tags.get(0) : null);
            p.put("predicted_tag2", tags.size() > 1 ? tags.get(1) : null);
            p.put("predicted_tag3", tags.size() > 2 ? tags.get(2) : null);
            p.put("predicted_confidence", result.prediction() != null ? result.prediction().confidence() : 0.0);
            ArrayNode truth = p.putArray("ground_truth_tags");
            row.groundTruth().tags().forEach(truth::add);
            p.put("is_correct", row.correctAt1());
            if (row.matchPosition() != null) {
                p.put("match_priority", row.matchPosition());
            } else {
                p.putNull("match_priority");
            }
            p.put("error_message", row.errorMessage());
        }

        AggregateMetrics m = report.metrics();
        AggregateMetrics.RunStatistics stats = m.runStatistics();
        ObjectNode metrics = root.putObject("metrics");
        metrics.put("accuracy_at_1", m.accuracyAt1());
        metrics.put("accuracy_at_2", m.accuracyAt2());
        metrics.put("accuracy_at_3", m.accuracyAt3());
        metrics.put("weighted_accuracy", m.weightedAccuracy());
        metrics.put("exact_match_at_1", m.exactMatchAt1());
        metrics.put("exact_match_at_2", m.exactMatchAt2());
        metrics.put("exact_match_at_3", m.exactMatchAt3());
        metrics.put("precision", m.precision());
        metrics.put("recall", m.recall());
        metrics.put("f1_score", m.f1Score());
        metrics.put("average_confidence", m.averageConfidence());
        metrics.put("total_predictions", m.totalPredictions());
        metrics.put("correct_predictions", m.correctPredictions());
        metrics.put("model_used", stats.modelUsed());
        metrics.put("total_participant_processing_time_ms", stats.totalProcessingTimeMs());
        metrics.put("average_participant_processing_time_ms", stats.averageProcessingTimeMs());
        metrics.put("total_participant_cost_dkk", stats.totalCost());
        metrics.put("total_participant_tokens_used", stats.totalTokensUsed());
        metrics.put("dashboard_evaluation_time_ms", report.evaluationTimeMs());
        return root;
    }
}
