package com.example.tagging.model;

import java.util.List;

/**
 * Prompt sent to the model together with the tags it may choose from.
 *
 * @param prompt        full user prompt
 * @param availableTags registry tag names at generation time, in registry order
 */
public record PromptPayload(String prompt, List<String> availableTags) {
    public PromptPayload {
        availableTags = availableTags != null ? List.copyOf(availableTags) : List.of();
    }
}
