package com.example.tagging.registry;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only set of valid tags, built once at startup and shared by every stage.
 * Iteration follows the order of the rules file.
 */
public final class TagRuleRegistry {

    private final Map<String, TagRule> rules;

    private TagRuleRegistry(Map<String, TagRule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    /**
     * Builds a registry; a later rule with an already seen name replaces the earlier one
     * but keeps its position.
     */
    public static TagRuleRegistry of(List<TagRule> rules) {
        Map<String, TagRule> byName = new LinkedHashMap<>();
        for (TagRule rule : rules) {
            byName.put(rule.name(), rule);
        }
        return new TagRuleRegistry(byName);
    }

    /** Registry with plain tag names and no descriptions, mostly for tests. */
    public static TagRuleRegistry ofNames(String... names) {
        return of(Arrays.stream(names)
                .map(n -> new TagRule(TagNames.normalize(n), n, "", "", List.of()))
                .toList());
    }

    public Set<String> tagNames() {
        return rules.keySet();
    }

    public List<String> tagNameList() {
        return List.copyOf(rules.keySet());
    }

    public List<TagRule> rules() {
        return List.copyOf(rules.values());
    }

    public Optional<TagRule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public boolean contains(String name) {
        return name != null && rules.containsKey(name);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
