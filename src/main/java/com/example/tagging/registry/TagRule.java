package com.example.tagging.registry;

import java.util.List;

/**
 * Definition of one tag of the taxonomy.
 *
 * @param name         normalized tag name, e.g. {@code BYGGERI_OG_ANLÆG}
 * @param mainCategory main category as written in the rules file
 * @param subCategory  sub category as written in the rules file, may be empty
 * @param description  what the tag covers
 * @param examples     example offerings that fit the tag
 */
public record TagRule(
        String name,
        String mainCategory,
        String subCategory,
        String description,
        List<String> examples
) {
    public TagRule {
        examples = examples != null ? List.copyOf(examples) : List.of();
    }

    public String displayName() {
        return subCategory == null || subCategory.isBlank()
                ? mainCategory
                : mainCategory + " - " + subCategory;
    }
}
