package com.example.tagging.registry;

import java.util.Locale;

/**
 * Normalization of tag names as they appear in rules files, datasets and model answers.
 */
public final class TagNames {

    private TagNames() {
    }

    /**
     * Upper-cases and replaces spaces, slashes and dashes with underscores.
     * Returns null for null or blank input.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.strip()
                .replace(' ', '_')
                .replace('/', '_')
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
    }
}
