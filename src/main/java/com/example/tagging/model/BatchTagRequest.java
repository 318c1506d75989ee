package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Batch tagging request body.
 */
public record BatchTagRequest(@JsonProperty("events") List<TagEventRequest> events) {}
