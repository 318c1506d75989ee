package com.example.tagging.controller;

import com.example.tagging.evaluation.EvaluationEngine;
import com.example.tagging.model.BatchTagRequest;
import com.example.tagging.model.BatchTagResult;
import com.example.tagging.model.EvaluationReport;
import com.example.tagging.model.EvaluationRequest;
import com.example.tagging.model.EventRecord;
import com.example.tagging.model.ProcessingResult;
import com.example.tagging.model.PromptPayload;
import com.example.tagging.model.SubmissionRequest;
import com.example.tagging.model.TagEventRequest;
import com.example.tagging.model.TagEventResponse;
import com.example.tagging.orchestrator.EventProcessor;
import com.example.tagging.registry.TagRule;
import com.example.tagging.registry.TagRuleRegistry;
import com.example.tagging.service.DatasetException;
import com.example.tagging.service.DatasetLoader;
import com.example.tagging.service.SubmissionException;
import com.example.tagging.service.SubmissionService;
import com.example.tagging.stage.InputValidator;
import com.example.tagging.stage.PromptGenerator;
import com.example.tagging.stage.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for event tagging and evaluation.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventTaggingController {

    private static final Logger log = LoggerFactory.getLogger(EventTaggingController.class);

    static final int MAX_BATCH_SIZE = 100;

    private final EventProcessor processor;
    private final TagRuleRegistry registry;
    private final InputValidator inputValidator;
    private final PromptGenerator promptGenerator;
    private final DatasetLoader datasetLoader;
    private final EvaluationEngine evaluationEngine;
    private final SubmissionService submissionService;

    public EventTaggingController(EventProcessor processor,
                                  TagRuleRegistry registry,
                                  InputValidator inputValidator,
                                  PromptGenerator promptGenerator,
                                  DatasetLoader datasetLoader,
                                  EvaluationEngine evaluationEngine,
                                  SubmissionService submissionService) {
        this.processor = processor;
        this.registry = registry;
        this.inputValidator = inputValidator;
        this.promptGenerator = promptGenerator;
        this.datasetLoader = datasetLoader;
        this.evaluationEngine = evaluationEngine;
        this.submissionService = submissionService;
    }

    /**
     * Tags a single event.
     *
     * <p>Endpoint: POST /api/v1/events/tag
     */
    @PostMapping(value = "/tag", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> tag(@RequestBody TagEventRequest request) {
        if (request == null) {
            return badRequest("Request body is required");
        }
        log.info("Received tagging request for event {}", request.arrangementNummer());

        ProcessingResult result;
        try {
            result = processor.process(request.toEventRecord());
        } catch (Exception e) {
            log.error("Error while tagging event {}", request.arrangementNummer(), e);
            return ResponseEntity.internalServerError()
                    .body(errorBody("Error during tagging", e));
        }
        TagEventResponse body = TagEventResponse.from(result,
                request.reasoningRequested(), request.confidenceRequested());
        return switch (result.status()) {
            case VALIDATION_FAILED -> ResponseEntity.badRequest().body(body);
            case UPSTREAM_FAILED -> ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
            case PIPELINE_FAILED -> ResponseEntity.internalServerError().body(body);
            default -> ResponseEntity.ok(body);
        };
    }

    /**
     * Tags up to {@value #MAX_BATCH_SIZE} events. Event numbers must be unique within the batch.
     *
     * <p>Endpoint: POST /api/v1/events/tag/batch
     */
    @PostMapping(value = "/tag/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> tagBatch(@RequestBody BatchTagRequest request) {
        if (request == null || request.events() == null || request.events().isEmpty()) {
            return badRequest("At least one event is required");
        }
        if (request.events().size() > MAX_BATCH_SIZE) {
            return badRequest("Batch size exceeds maximum of " + MAX_BATCH_SIZE + " events");
        }
        Set<String> seen = new HashSet<>();
        List<EventRecord> events = new ArrayList<>();
        for (TagEventRequest event : request.events()) {
            String id = event.arrangementNummer();
            if (id != null && !id.isBlank() && !seen.add(id)) {
                return badRequest("Duplicate event id in batch: " + id);
            }
            events.add(event.toEventRecord());
        }

        log.info("Received batch tagging request for {} events", events.size());
        BatchTagResult result = processor.processBatch(events);
        return ResponseEntity.ok(result);
    }

    /**
     * Lists the tags of the loaded taxonomy.
     *
     * <p>Endpoint: GET /api/v1/events/tags
     */
    @GetMapping("/tags")
    public ResponseEntity<Map<String, Object>> tags() {
        List<Map<String, Object>> rules = new ArrayList<>();
        for (TagRule rule : registry.rules()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", rule.name());
            entry.put("main_category", rule.mainCategory());
            entry.put("sub_category", rule.subCategory());
            entry.put("description", rule.description());
            entry.put("examples", rule.examples());
            rules.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tags", registry.tagNameList());
        body.put("count", registry.size());
        body.put("rules", rules);
        return ResponseEntity.ok(body);
    }

    /**
     * Shows the prompt that would be sent for an event, without calling the model.
     *
     * <p>Endpoint: POST /api/v1/events/debug-prompt
     */
    @PostMapping(value = "/debug-prompt", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> debugPrompt(@RequestBody TagEventRequest request) {
        if (request == null) {
            return badRequest("Request body is required");
        }
        try {
            EventRecord cleaned = inputValidator.validate(request.toEventRecord());
            PromptPayload payload = promptGenerator.generate(cleaned, registry.tagNameList());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("event_id", cleaned.id());
            body.put("prompt", payload.prompt());
            body.put("prompt_length", payload.prompt().length());
            body.put("available_tags", payload.availableTags());
            return ResponseEntity.ok(body);
        } catch (ValidationException e) {
            return badRequest(e.getMessage());
        }
    }

    /**
     * Evaluates a labeled dataset and returns the full report.
     *
     * <p>Endpoint: POST /api/v1/events/evaluate
     */
    @PostMapping(value = "/evaluate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> evaluate(@RequestBody(required = false) EvaluationRequest request) {
        String dataset = request != null ? request.dataset() : null;
        log.info("Received evaluation request (dataset: {})", dataset != null ? dataset : "default");
        try {
            EvaluationReport report = evaluationEngine.evaluate(datasetLoader.load(dataset));
            return ResponseEntity.ok(report);
        } catch (DatasetException e) {
            log.warn("Evaluation rejected: {}", e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error during evaluation", e);
            return ResponseEntity.internalServerError()
                    .body(errorBody("Error during evaluation", e));
        }
    }

    /**
     * Evaluates the test dataset and forwards the results to the leaderboard.
     * The leaderboard's answer is returned unchanged.
     *
     * <p>Endpoint: POST /api/v1/events/submit
     */
    @PostMapping(value = "/submit", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submit(@RequestBody SubmissionRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            return badRequest("Participant name is required");
        }
        try {
            String response = submissionService.submit(request.name(), request.dataset());
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(response);
        } catch (IllegalArgumentException | DatasetException e) {
            return badRequest(e.getMessage());
        } catch (SubmissionException e) {
            log.error("Submission for '{}' failed: {}", request.name(), e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(errorBody("Submission failed", e));
        } catch (Exception e) {
            log.error("Error during submission for '{}'", request.name(), e);
            return ResponseEntity.internalServerError()
                    .body(errorBody("Error during submission", e));
        }
    }

    /**
     * <p>Endpoint: GET /api/v1/events/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", registry.isEmpty() ? "degraded" : "ok",
                "service", "event-tagger",
                "tagCount", registry.size()
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private static Map<String, String> errorBody(String error, Exception e) {
        return Map.of(
                "error", error,
                "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
        );
    }
}
