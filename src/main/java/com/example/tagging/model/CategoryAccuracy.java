package com.example.tagging.model;

/**
 * Accuracy@1 of the records whose primary reference tag is {@code tag}.
 */
public record CategoryAccuracy(String tag, int records, int correct, double accuracy) {}
