package com.example.tagging.stage;

import com.example.tagging.model.ParsedTagResult;

import java.util.Collection;

/**
 * Turns model text into tags. Never throws: unusable text gives {@link ParsedTagResult#invalid(String)}.
 */
@FunctionalInterface
public interface OutputParser {

    ParsedTagResult parse(String content, Collection<String> availableTags);
}
