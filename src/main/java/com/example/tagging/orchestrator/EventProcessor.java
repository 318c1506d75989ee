package com.example.tagging.orchestrator;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.BatchTagResult;
import com.example.tagging.model.EvaluatedPrediction;
import com.example.tagging.model.EventRecord;
import com.example.tagging.model.ParsedTagResult;
import com.example.tagging.model.ProcessingResult;
import com.example.tagging.model.ProcessingStatus;
import com.example.tagging.model.PromptPayload;
import com.example.tagging.model.RawModelOutput;
import com.example.tagging.registry.TagRuleRegistry;
import com.example.tagging.stage.ConfidenceEvaluator;
import com.example.tagging.stage.HumanReviewChecker;
import com.example.tagging.stage.InputValidator;
import com.example.tagging.stage.LlmClient;
import com.example.tagging.stage.OutputParser;
import com.example.tagging.stage.PromptGenerator;
import com.example.tagging.stage.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Tagging pipeline for a single event.
 * Pipeline:
 * 1. Input validation and cleaning
 * 2. Prompt generation from the tag registry
 * 3. LLM call
 * 4. Output parsing (bad output becomes an invalid result, not an error)
 * 5. Confidence scoring
 * 6. Human review decision
 * <p>
 * Failures in steps 1-3 end the run with a failed {@link ProcessingResult}. Nothing is retried here.
 * A parser that throws is treated as an unusable answer. The processor keeps no state between calls,
 * so concurrent calls are independent.
 */
@Service
public class EventProcessor {

    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    private final InputValidator inputValidator;
    private final PromptGenerator promptGenerator;
    private final LlmClient llmClient;
    private final OutputParser outputParser;
    private final ConfidenceEvaluator confidenceEvaluator;
    private final HumanReviewChecker humanReviewChecker;
    private final TagRuleRegistry registry;
    private final TaggingProperties properties;
    private final ExecutorService agentExecutor;

    public EventProcessor(InputValidator inputValidator,
                          PromptGenerator promptGenerator,
                          LlmClient llmClient,
                          OutputParser outputParser,
                          ConfidenceEvaluator confidenceEvaluator,
                          HumanReviewChecker humanReviewChecker,
                          TagRuleRegistry registry,
                          TaggingProperties properties,
                          ExecutorService agentExecutor) {
        this.inputValidator = inputValidator;
        this.promptGenerator = promptGenerator;
        this.llmClient = llmClient;
        this.outputParser = outputParser;
        this.confidenceEvaluator = confidenceEvaluator;
        this.humanReviewChecker = humanReviewChecker;
        this.registry = registry;
        this.properties = properties;
        this.agentExecutor = agentExecutor;
    }

    public ProcessingResult process(EventRecord event) {
        long start = System.nanoTime();
        String eventId = event != null && event.id() != null && !event.id().isBlank()
                ? event.id()
                : UUID.randomUUID().toString();
        log.info("Processing event {}: '{}'", eventId, event != null ? abbreviate(event.title()) : null);

        // ── Step 1: Input validation ──
        EventRecord cleaned;
        try {
            cleaned = inputValidator.validate(event != null ? event.withId(eventId) : null);
        } catch (ValidationException e) {
            log.warn("[1/6] Event {} rejected: {}", eventId, e.getMessage());
            return ProcessingResult.failed(eventId, ProcessingStatus.VALIDATION_FAILED, e.getMessage(), elapsedMs(start));
        } catch (RuntimeException e) {
            log.error("[1/6] Input validator failed for event {}", eventId, e);
            return ProcessingResult.failed(eventId, ProcessingStatus.PIPELINE_FAILED,
                    "Input validation failed: " + describe(e), elapsedMs(start));
        }
        log.debug("[1/6] Event {} validated", eventId);

        // ── Step 2: Prompt generation ──
        PromptPayload payload;
        try {
            payload = promptGenerator.generate(cleaned, registry.tagNameList());
        } catch (RuntimeException e) {
            log.error("[2/6] Prompt generation failed for event {}", eventId, e);
            return ProcessingResult.failed(eventId, ProcessingStatus.PIPELINE_FAILED,
                    "Prompt generation failed: " + describe(e), elapsedMs(start));
        }
        if (payload.availableTags().isEmpty()) {
            log.error("[2/6] No available tags for event {}", eventId);
            return ProcessingResult.failed(eventId, ProcessingStatus.VALIDATION_FAILED, "No available tags found", elapsedMs(start));
        }
        log.debug("[2/6] Prompt for event {}: {} characters, {} tags",
                eventId, payload.prompt().length(), payload.availableTags().size());

        // ── Step 3: LLM call ──
        RawModelOutput output;
        try {
            output = llmClient.complete(payload.prompt(),
                    properties.llm().temperature(), properties.llm().maxTokens());
        } catch (RuntimeException e) {
            log.error("[3/6] LLM call failed for event {}: {}", eventId, e.getMessage());
            return ProcessingResult.failed(eventId, ProcessingStatus.UPSTREAM_FAILED, e.getMessage(), elapsedMs(start));
        }
        log.debug("[3/6] LLM response for event {} ({} tokens): {}",
                eventId, output.tokensUsed(), abbreviate(output.content()));

        // ── Step 4: Output parsing ──
        ParsedTagResult parsed;
        try {
            parsed = enforceRegistry(outputParser.parse(output.content(), payload.availableTags()));
        } catch (RuntimeException e) {
            log.error("[4/6] Output parser failed for event {}", eventId, e);
            parsed = ParsedTagResult.invalid("Output parser failed: " + describe(e));
        }
        if (!parsed.valid()) {
            log.warn("[4/6] Invalid LLM response for event {}: {}", eventId, parsed.error());
        }

        // ── Step 5: Confidence ──
        double confidence = confidenceEvaluator.evaluate(parsed);

        // ── Step 6: Human review ──
        boolean review = humanReviewChecker.needsReview(parsed, confidence);

        double elapsed = elapsedMs(start);
        double cost = properties.cost().estimate(output.tokensUsed());
        ProcessingResult result = ProcessingResult.completed(eventId,
                new EvaluatedPrediction(parsed, confidence, review), elapsed, output.tokensUsed(), cost, output.model());
        log.info("Event {} processed in {}ms: status={}, tags={}, confidence={}",
                eventId, String.format("%.1f", elapsed), result.status(), parsed.tags(), confidence);
        return result;
    }

    /**
     * Processes the events in order. Above the batch size threshold the events run on the
     * worker pool; results are still returned in input order.
     */
    public List<ProcessingResult> processAll(List<EventRecord> events) {
        int threshold = properties.evaluation().batchSizeThreshold();
        if (events.size() <= threshold) {
            return events.stream().map(this::processContained).toList();
        }
        log.info("Dispatching {} events to the worker pool (threshold {})", events.size(), threshold);
        List<CompletableFuture<ProcessingResult>> futures = events.stream()
                .map(e -> CompletableFuture.supplyAsync(() -> processContained(e), agentExecutor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /**
     * Like {@link #process} but never throws, so one broken record cannot take down a batch.
     */
    ProcessingResult processContained(EventRecord event) {
        long start = System.nanoTime();
        try {
            return process(event);
        } catch (RuntimeException e) {
            String eventId = event != null && event.id() != null && !event.id().isBlank()
                    ? event.id()
                    : UUID.randomUUID().toString();
            log.error("Processing of event {} aborted", eventId, e);
            return ProcessingResult.failed(eventId, ProcessingStatus.PIPELINE_FAILED, describe(e), elapsedMs(start));
        }
    }

    public BatchTagResult processBatch(List<EventRecord> events) {
        long start = System.nanoTime();
        String batchId = UUID.randomUUID().toString();
        log.info("Processing batch {} of {} events", batchId, events.size());

        List<ProcessingResult> results = processAll(events);

        int successful = 0;
        int failed = 0;
        int review = 0;
        int scored = 0;
        double confidenceSum = 0.0;
        for (ProcessingResult r : results) {
            if (r.isFailure() || r.status() == ProcessingStatus.INVALID_OUTPUT) {
                failed++;
            } else {
                successful++;
            }
            if (r.needsHumanReview()) {
                review++;
            }
            if (r.prediction() != null) {
                scored++;
                confidenceSum += r.prediction().confidence();
            }
        }
        BatchTagResult.BatchTagSummary summary = new BatchTagResult.BatchTagSummary(
                events.size(), successful, failed, review, elapsedMs(start),
                scored > 0 ? confidenceSum / scored : 0.0);
        log.info("Batch {} completed: {}/{} successful, {} need review", batchId, successful, events.size(), review);
        return new BatchTagResult(batchId, results, summary, LocalDateTime.now());
    }

    /** Tags outside the registry make the whole answer invalid. */
    private ParsedTagResult enforceRegistry(ParsedTagResult parsed) {
        if (!parsed.valid()) {
            return parsed;
        }
        for (String tag : parsed.tags()) {
            if (!registry.contains(tag)) {
                return ParsedTagResult.invalid("Tag '" + tag + "' is not in the tag registry");
            }
        }
        return parsed;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String abbreviate(String text) {
        if (text == null) return null;
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
