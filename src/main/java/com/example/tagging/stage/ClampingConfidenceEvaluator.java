package com.example.tagging.stage;

import com.example.tagging.model.ParsedTagResult;
import org.springframework.stereotype.Service;

/**
 * Uses the confidence reported by the model, clamped to [0, 1]. Invalid results score 0.
 */
@Service
public class ClampingConfidenceEvaluator implements ConfidenceEvaluator {

    @Override
    public double evaluate(ParsedTagResult parsed) {
        if (parsed == null) {
            throw new ComputationException("Cannot score a missing parse result");
        }
        if (!parsed.valid()) {
            return 0.0;
        }
        double raw = parsed.rawConfidence();
        if (Double.isNaN(raw)) {
            throw new ComputationException("Valid parse result carries a NaN confidence");
        }
        return Math.max(0.0, Math.min(1.0, raw));
    }
}
