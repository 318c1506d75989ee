package com.example.tagging.stage;

import com.example.tagging.model.ParsedTagResult;

@FunctionalInterface
public interface HumanReviewChecker {

    boolean needsReview(ParsedTagResult parsed, double confidence);
}
