package com.example.tagging.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for the tagging pipeline and the evaluation engine.
 * Missing sections fall back to the workshop defaults.
 */
@ConfigurationProperties(prefix = "tagging")
public record TaggingProperties(
        Data data,
        Llm llm,
        Thresholds thresholds,
        Cost cost,
        Evaluation evaluation,
        Dashboard dashboard,
        List<String> sensitiveKeywords
) {

    public TaggingProperties {
        if (data == null) data = new Data(null, null, null);
        if (llm == null) llm = new Llm(null, null, null, null, null);
        if (thresholds == null) thresholds = new Thresholds(null, null);
        if (cost == null) cost = new Cost(null);
        if (evaluation == null) evaluation = new Evaluation(null, null, null, null, null);
        if (dashboard == null) dashboard = new Dashboard(null, null);
        sensitiveKeywords = sensitiveKeywords != null ? List.copyOf(sensitiveKeywords) : List.of();
    }

    /**
     * Location of the CSV inputs.
     *
     * @param dir          data directory
     * @param tagRulesFile tag rules file name, relative to {@code dir}
     * @param testDataset  labeled test set file name, relative to {@code dir}
     */
    public record Data(String dir, String tagRulesFile, String testDataset) {
        public Data {
            if (dir == null || dir.isBlank()) dir = "data";
            if (tagRulesFile == null || tagRulesFile.isBlank()) tagRulesFile = "tagsregler.csv";
            if (testDataset == null || testDataset.isBlank()) testDataset = "arrangementer_til_tagging_test_set.csv";
        }
    }

    /**
     * Parameters of the language model call.
     *
     * @param temperature    sampling temperature
     * @param maxTokens      completion token cap
     * @param maxRetries     retries after the first failed attempt
     * @param retryBackoffMs base backoff, multiplied by the attempt number
     * @param systemPrompt   system message sent with every request
     */
    public record Llm(Double temperature, Integer maxTokens, Integer maxRetries,
                      Long retryBackoffMs, String systemPrompt) {
        public Llm {
            if (temperature == null) temperature = 0.3;
            if (maxTokens == null) maxTokens = 500;
            if (maxRetries == null) maxRetries = 2;
            if (retryBackoffMs == null) retryBackoffMs = 2000L;
            if (systemPrompt == null || systemPrompt.isBlank()) {
                systemPrompt = "You are an expert at tagging events.";
            }
        }
    }

    /**
     * @param confidence  below this a prediction without a secondary tag goes to review
     * @param humanReview below this every prediction goes to review
     */
    public record Thresholds(Double confidence, Double humanReview) {
        public Thresholds {
            if (confidence == null) confidence = 0.7;
            if (humanReview == null) humanReview = 0.5;
            if (confidence < 0.0 || confidence > 1.0 || humanReview < 0.0 || humanReview > 1.0) {
                throw new IllegalArgumentException("Thresholds must be within [0, 1]");
            }
        }
    }

    /**
     * @param per1kTokens estimated price of 1000 tokens, unrounded
     */
    public record Cost(Double per1kTokens) {
        public Cost {
            if (per1kTokens == null) per1kTokens = 0.03;
        }

        public double estimate(long tokens) {
            return tokens / 1000.0 * per1kTokens;
        }
    }

    /**
     * @param batchSizeThreshold above this many records processing is dispatched to the executor
     * @param parallelism        size of the shared worker pool
     * @param confusedTopN       number of confusion pairs reported
     * @param categoryListSize   number of best and worst categories reported
     * @param accuracyWeights    weights of accuracy@1, @2 and @3 in the weighted accuracy
     */
    public record Evaluation(Integer batchSizeThreshold, Integer parallelism, Integer confusedTopN,
                             Integer categoryListSize, List<Double> accuracyWeights) {
        public Evaluation {
            if (batchSizeThreshold == null) batchSizeThreshold = 50;
            if (parallelism == null || parallelism < 1) parallelism = 8;
            if (confusedTopN == null || confusedTopN < 0) confusedTopN = 5;
            if (categoryListSize == null || categoryListSize < 0) categoryListSize = 3;
            if (accuracyWeights == null || accuracyWeights.isEmpty()) {
                accuracyWeights = List.of(1.0 / 2, 1.0 / 6, 1.0 / 3);
            }
            accuracyWeights = List.copyOf(accuracyWeights);
            validateWeights(accuracyWeights);
        }

        private static void validateWeights(List<Double> weights) {
            if (weights.size() != 3) {
                throw new IllegalArgumentException("Exactly three accuracy weights are required, got " + weights.size());
            }
            double sum = 0.0;
            for (Double w : weights) {
                if (w == null || w < 0.0) {
                    throw new IllegalArgumentException("Accuracy weights must be non-negative: " + weights);
                }
                sum += w;
            }
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalArgumentException("Accuracy weights must sum to 1, got " + sum);
            }
        }
    }

    /**
     * Leaderboard endpoint.
     *
     * @param baseUrl    base URL of the dashboard
     * @param submitPath path receiving submissions
     */
    public record Dashboard(String baseUrl, String submitPath) {
        public Dashboard {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:3000";
            if (submitPath == null || submitPath.isBlank()) submitPath = "/api/submit";
        }
    }
}
