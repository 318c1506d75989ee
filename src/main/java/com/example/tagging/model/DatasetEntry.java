package com.example.tagging.model;

/**
 * One labeled example of an evaluation dataset.
 */
public record DatasetEntry(EventRecord event, GroundTruthRecord groundTruth) {}
