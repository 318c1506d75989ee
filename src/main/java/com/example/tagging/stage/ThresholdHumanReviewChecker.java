package com.example.tagging.stage;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.ParsedTagResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Flags a prediction for review when it is invalid, when its confidence is under the
 * review threshold, or when it is under the confidence threshold with no secondary tag.
 */
@Service
public class ThresholdHumanReviewChecker implements HumanReviewChecker {

    private final double confidenceThreshold;
    private final double reviewThreshold;

    @Autowired
    public ThresholdHumanReviewChecker(TaggingProperties properties) {
        this(properties.thresholds().confidence(), properties.thresholds().humanReview());
    }

    public ThresholdHumanReviewChecker(double confidenceThreshold, double reviewThreshold) {
        this.confidenceThreshold = confidenceThreshold;
        this.reviewThreshold = reviewThreshold;
    }

    @Override
    public boolean needsReview(ParsedTagResult parsed, double confidence) {
        if (parsed == null || !parsed.valid() || parsed.tags().isEmpty()) {
            return true;
        }
        if (confidence < reviewThreshold) {
            return true;
        }
        return confidence < confidenceThreshold && !parsed.hasSecondaryTag();
    }
}
