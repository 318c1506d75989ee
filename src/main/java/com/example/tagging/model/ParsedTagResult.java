package com.example.tagging.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured reading of a model answer.
 * An invalid result carries no tags, zero confidence and the reason in {@code error}.
 *
 * @param tag1          most likely tag
 * @param tag2          second choice, may be null
 * @param tag3          third choice, may be null
 * @param rawConfidence confidence reported by the model
 * @param reasoning     model explanation, may be null
 * @param valid         whether the answer could be used
 * @param error         parse failure message when not valid
 */
public record ParsedTagResult(
        String tag1,
        String tag2,
        String tag3,
        double rawConfidence,
        String reasoning,
        boolean valid,
        String error
) {

    public static ParsedTagResult valid(String tag1, String tag2, String tag3, double confidence, String reasoning) {
        return new ParsedTagResult(tag1, tag2, tag3, confidence, reasoning, true, null);
    }

    public static ParsedTagResult invalid(String error) {
        return new ParsedTagResult(null, null, null, 0.0, null, false, error);
    }

    /** Non-empty predicted tags, most likely first. */
    public List<String> tags() {
        List<String> tags = new ArrayList<>(3);
        for (String t : new String[]{tag1, tag2, tag3}) {
            if (t != null && !t.isBlank()) {
                tags.add(t);
            }
        }
        return Collections.unmodifiableList(tags);
    }

    public boolean hasSecondaryTag() {
        return tags().size() > 1;
    }
}
