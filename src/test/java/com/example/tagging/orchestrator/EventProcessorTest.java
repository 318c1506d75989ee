package com.example.tagging.orchestrator;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.BatchTagResult;
import com.example.tagging.model.EventRecord;
import com.example.tagging.model.ProcessingResult;
import com.example.tagging.model.ProcessingStatus;
import com.example.tagging.model.PromptPayload;
import com.example.tagging.model.RawModelOutput;
import com.example.tagging.registry.TagRuleRegistry;
import com.example.tagging.stage.ClampingConfidenceEvaluator;
import com.example.tagging.stage.ComputationException;
import com.example.tagging.stage.DefaultInputValidator;
import com.example.tagging.stage.JsonOutputParser;
import com.example.tagging.stage.LlmClient;
import com.example.tagging.stage.PromptGenerator;
import com.example.tagging.stage.ThresholdHumanReviewChecker;
import com.example.tagging.stage.UpstreamException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class EventProcessorTest {

    private static final TagRuleRegistry REGISTRY = TagRuleRegistry.ofNames("SPORT", "MUSIK", "KULTUR");

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("confident answer with a registry tag succeeds")
    void success() {
        EventProcessor processor = processor(prompt -> answer(
                "{\"TAG1\": \"SPORT\", \"TAG2\": \"KULTUR\", \"CONFIDENCE\": 0.9, \"REASONING\": \"ok\"}"), 50);

        ProcessingResult result = processor.process(event("42", "Fodboldturnering"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.SUCCESS);
        assertThat(result.eventId()).isEqualTo("42");
        assertThat(result.predictedTags()).containsExactly("SPORT", "KULTUR");
        assertThat(result.prediction().confidence()).isEqualTo(0.9);
        assertThat(result.needsHumanReview()).isFalse();
        assertThat(result.tokensUsed()).isEqualTo(1000L);
        assertThat(result.estimatedCost()).isCloseTo(0.03, offset(1e-9));
        assertThat(result.model()).isEqualTo("test-model");
        assertThat(result.processingTimeMs()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void lowConfidenceGoesToReview() {
        EventProcessor processor = processor(prompt -> answer("{\"TAG1\": \"SPORT\", \"CONFIDENCE\": 0.3}"), 50);

        ProcessingResult result = processor.process(event("1", "Fodboldturnering"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.HUMAN_REVIEW_REQUIRED);
        assertThat(result.needsHumanReview()).isTrue();
    }

    @Test
    void unparseableAnswerIsInvalidOutputNotFailure() {
        EventProcessor processor = processor(prompt -> answer("Sorry, no idea"), 50);

        ProcessingResult result = processor.process(event("1", "Fodboldturnering"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.INVALID_OUTPUT);
        assertThat(result.isFailure()).isFalse();
        assertThat(result.predictedTags()).isEmpty();
        assertThat(result.prediction().confidence()).isZero();
        assertThat(result.needsHumanReview()).isTrue();
        assertThat(result.tokensUsed()).isEqualTo(1000L);
    }

    @Test
    void validationFailureSkipsTheModel() {
        List<String> prompts = new ArrayList<>();
        EventProcessor processor = processor(prompt -> {
            prompts.add(prompt);
            return answer("{\"TAG1\": \"SPORT\"}");
        }, 50);

        ProcessingResult result = processor.process(event("1", "ab"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.VALIDATION_FAILED);
        assertThat(result.isFailure()).isTrue();
        assertThat(result.prediction()).isNull();
        assertThat(result.errorMessage()).contains("Title");
        assertThat(prompts).isEmpty();
    }

    @Test
    void upstreamFailureIsReported() {
        EventProcessor processor = processor(prompt -> {
            throw new UpstreamException("LLM call failed after 3 attempts: timeout");
        }, 50);

        ProcessingResult result = processor.process(event("1", "Fodboldturnering"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.UPSTREAM_FAILED);
        assertThat(result.errorMessage()).contains("timeout");
        assertThat(result.tokensUsed()).isZero();
        assertThat(result.needsHumanReview()).isTrue();
    }

    @Test
    void emptyTagListFailsValidation() {
        EventProcessor processor = new EventProcessor(new DefaultInputValidator(List.of()),
                (event, tags) -> new PromptPayload("p", tags),
                (prompt, temperature, maxTokens) -> answer("{\"TAG1\": \"SPORT\"}"),
                new JsonOutputParser(), new ClampingConfidenceEvaluator(), new ThresholdHumanReviewChecker(0.7, 0.5),
                TagRuleRegistry.of(List.of()), properties(50), executor);

        ProcessingResult result = processor.process(event("1", "Fodboldturnering"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.VALIDATION_FAILED);
        assertThat(result.errorMessage()).isEqualTo("No available tags found");
    }

    @Test
    void tagOutsideRegistryIsInvalid() {
        PromptGenerator generator = (event, tags) -> new PromptPayload("p", List.of("SPORT", "DANS"));
        EventProcessor processor = new EventProcessor(new DefaultInputValidator(List.of()), generator,
                (prompt, temperature, maxTokens) -> answer("{\"TAG1\": \"DANS\", \"CONFIDENCE\": 0.9}"),
                new JsonOutputParser(), new ClampingConfidenceEvaluator(), new ThresholdHumanReviewChecker(0.7, 0.5),
                REGISTRY, properties(50), executor);

        ProcessingResult result = processor.process(event("1", "Dansekursus"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.INVALID_OUTPUT);
        assertThat(result.errorMessage()).contains("DANS");
    }

    @Test
    void assignsIdWhenMissing() {
        EventProcessor processor = processor(prompt -> answer("{\"TAG1\": \"SPORT\", \"CONFIDENCE\": 0.9}"), 50);

        ProcessingResult result = processor.process(event(" ", "Fodboldturnering"));

        assertThat(result.eventId()).isNotBlank();
    }

    @Test
    @DisplayName("parallel processing returns results in input order")
    void parallelKeepsOrder() {
        EventProcessor processor = processor(prompt -> {
            String tag = prompt.contains("Title: even") ? "SPORT" : "MUSIK";
            return answer("{\"TAG1\": \"" + tag + "\", \"CONFIDENCE\": 0.9}");
        }, 0);
        List<EventRecord> events = IntStream.range(0, 40)
                .mapToObj(i -> event(String.valueOf(i), (i % 2 == 0 ? "even" : "odd") + " event " + i))
                .toList();

        List<ProcessingResult> results = processor.processAll(events);

        assertThat(results).hasSize(40);
        for (int i = 0; i < 40; i++) {
            assertThat(results.get(i).eventId()).isEqualTo(String.valueOf(i));
            assertThat(results.get(i).topTag()).isEqualTo(i % 2 == 0 ? "SPORT" : "MUSIK");
        }
    }

    @Test
    void batchSummaryCountsOutcomes() {
        EventProcessor processor = processor(prompt -> {
            if (prompt.contains("Title: broken")) return answer("garbage");
            if (prompt.contains("Title: unsure")) return answer("{\"TAG1\": \"SPORT\", \"CONFIDENCE\": 0.2}");
            return answer("{\"TAG1\": \"SPORT\", \"CONFIDENCE\": 0.8}");
        }, 50);

        BatchTagResult batch = processor.processBatch(List.of(
                event("1", "good event"),
                event("2", "broken event"),
                event("3", "unsure event"),
                event("4", "x")));

        BatchTagResult.BatchTagSummary summary = batch.summary();
        assertThat(batch.results()).extracting(ProcessingResult::eventId).containsExactly("1", "2", "3", "4");
        assertThat(summary.totalEvents()).isEqualTo(4);
        assertThat(summary.successful()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.needsHumanReview()).isEqualTo(3);
        assertThat(summary.averageConfidence()).isCloseTo((0.8 + 0.0 + 0.2) / 3, offset(1e-9));
    }

    @Test
    @DisplayName("a validator that throws unexpectedly fails the pipeline, not the caller")
    void throwingValidatorIsPipelineFailure() {
        EventProcessor processor = new EventProcessor(
                event -> {
                    throw new IllegalStateException("stop words not loaded");
                },
                (event, tags) -> new PromptPayload("p", tags),
                (prompt, temperature, maxTokens) -> answer("{\"TAG1\": \"SPORT\"}"),
                new JsonOutputParser(), new ClampingConfidenceEvaluator(), new ThresholdHumanReviewChecker(0.7, 0.5),
                REGISTRY, properties(50), executor);

        ProcessingResult result = processor.process(event("7", "Fodboldturnering"));

        assertThat(result.eventId()).isEqualTo("7");
        assertThat(result.status()).isEqualTo(ProcessingStatus.PIPELINE_FAILED);
        assertThat(result.isFailure()).isTrue();
        assertThat(result.errorMessage()).contains("stop words not loaded");
    }

    @Test
    void throwingPromptGeneratorIsPipelineFailure() {
        EventProcessor processor = new EventProcessor(new DefaultInputValidator(List.of()),
                (event, tags) -> {
                    throw new IllegalStateException("template missing");
                },
                (prompt, temperature, maxTokens) -> answer("{\"TAG1\": \"SPORT\"}"),
                new JsonOutputParser(), new ClampingConfidenceEvaluator(), new ThresholdHumanReviewChecker(0.7, 0.5),
                REGISTRY, properties(50), executor);

        ProcessingResult result = processor.process(event("1", "Fodboldturnering"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.PIPELINE_FAILED);
        assertThat(result.errorMessage()).isEqualTo("Prompt generation failed: template missing");
    }

    @Test
    void throwingParserIsInvalidOutput() {
        EventProcessor processor = new EventProcessor(new DefaultInputValidator(List.of()),
                (event, tags) -> new PromptPayload("p", tags),
                (prompt, temperature, maxTokens) -> answer("{\"TAG1\": \"SPORT\"}"),
                (content, available) -> {
                    throw new NullPointerException();
                },
                new ClampingConfidenceEvaluator(), new ThresholdHumanReviewChecker(0.7, 0.5),
                REGISTRY, properties(50), executor);

        ProcessingResult result = processor.process(event("1", "Fodboldturnering"));

        assertThat(result.status()).isEqualTo(ProcessingStatus.INVALID_OUTPUT);
        assertThat(result.isFailure()).isFalse();
        assertThat(result.errorMessage()).isEqualTo("Output parser failed: NullPointerException");
        assertThat(result.needsHumanReview()).isTrue();
        assertThat(result.tokensUsed()).isEqualTo(1000L);
    }

    @ParameterizedTest(name = "batch size threshold {0}")
    @ValueSource(ints = {50, 0})
    void processAllTurnsStageExceptionIntoFailedResult(int batchSizeThreshold) {
        EventProcessor processor = new EventProcessor(new DefaultInputValidator(List.of()),
                (event, tags) -> new PromptPayload("Title: " + event.title(), tags),
                (prompt, temperature, maxTokens) -> answer(prompt.contains("concert")
                        ? "{\"TAG1\": \"MUSIK\", \"CONFIDENCE\": 0.9}"
                        : "{\"TAG1\": \"SPORT\", \"CONFIDENCE\": 0.9}"),
                new JsonOutputParser(),
                parsed -> {
                    if (parsed.tags().contains("MUSIK")) {
                        throw new ComputationException("confidence out of range");
                    }
                    return parsed.rawConfidence();
                },
                new ThresholdHumanReviewChecker(0.7, 0.5),
                REGISTRY, properties(batchSizeThreshold), executor);

        List<ProcessingResult> results = processor.processAll(List.of(
                event("1", "football match"),
                event("2", "rock concert"),
                event("3", "tennis final")));

        assertThat(results).extracting(ProcessingResult::eventId).containsExactly("1", "2", "3");
        assertThat(results).extracting(ProcessingResult::status).containsExactly(
                ProcessingStatus.SUCCESS, ProcessingStatus.PIPELINE_FAILED, ProcessingStatus.SUCCESS);
        assertThat(results.get(1).errorMessage()).isEqualTo("confidence out of range");
    }

    private EventProcessor processor(FakeModel model, int batchSizeThreshold) {
        return new EventProcessor(
                new DefaultInputValidator(List.of()),
                (event, tags) -> new PromptPayload("Title: " + event.title() + "\nTags: " + tags, tags),
                model,
                new JsonOutputParser(),
                new ClampingConfidenceEvaluator(),
                new ThresholdHumanReviewChecker(0.7, 0.5),
                REGISTRY,
                properties(batchSizeThreshold),
                executor);
    }

    private static TaggingProperties properties(int batchSizeThreshold) {
        return new TaggingProperties(null, null, null, null,
                new TaggingProperties.Evaluation(batchSizeThreshold, 4, null, null, null), null, null);
    }

    private static RawModelOutput answer(String content) {
        return new RawModelOutput(content, 1000L, "test-model", "stop");
    }

    private static EventRecord event(String id, String title) {
        return new EventRecord(id, title, null, null, null, null, null);
    }

    @FunctionalInterface
    private interface FakeModel extends LlmClient {

        RawModelOutput reply(String prompt);

        @Override
        default RawModelOutput complete(String prompt, double temperature, int maxTokens) {
            return reply(prompt);
        }
    }
}
