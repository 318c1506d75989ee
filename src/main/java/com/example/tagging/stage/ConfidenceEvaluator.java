package com.example.tagging.stage;

import com.example.tagging.model.ParsedTagResult;

/**
 * Pure scoring of a parsed prediction.
 */
@FunctionalInterface
public interface ConfidenceEvaluator {

    /**
     * @return final confidence in [0, 1]; an invalid result scores 0
     * @throws ComputationException if the input is structurally broken
     */
    double evaluate(ParsedTagResult parsed);
}
