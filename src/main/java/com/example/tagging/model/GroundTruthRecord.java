package com.example.tagging.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reference tags of a labeled event, in priority order.
 */
public record GroundTruthRecord(String eventId, List<String> tags) {

    public GroundTruthRecord {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("Ground truth for event " + eventId + " has no tags");
        }
        tags = List.copyOf(tags);
    }

    public String primaryTag() {
        return tags.get(0);
    }

    public Set<String> tagSet() {
        return new LinkedHashSet<>(tags);
    }
}
