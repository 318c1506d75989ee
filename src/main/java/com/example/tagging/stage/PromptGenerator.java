package com.example.tagging.stage;

import com.example.tagging.model.EventRecord;
import com.example.tagging.model.PromptPayload;

import java.util.List;

@FunctionalInterface
public interface PromptGenerator {

    PromptPayload generate(EventRecord event, List<String> availableTags);
}
