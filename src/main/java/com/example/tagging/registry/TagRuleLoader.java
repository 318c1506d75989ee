package com.example.tagging.registry;

import com.example.tagging.service.CsvTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link TagRuleRegistry} from the tag rules CSV.
 * Column names are matched in Danish first, then in English.
 */
public final class TagRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(TagRuleLoader.class);

    /** Used when the rules file is missing or unreadable. */
    static final TagRule FALLBACK_RULE = new TagRule("GENERAL", "Generelt", "", "Generel kategori", List.of());

    private TagRuleLoader() {
    }

    public static TagRuleRegistry load(Path rulesFile) {
        if (!Files.exists(rulesFile)) {
            log.warn("Tag rules file not found: {}, falling back to a single {} tag", rulesFile, FALLBACK_RULE.name());
            return TagRuleRegistry.of(List.of(FALLBACK_RULE));
        }

        List<Map<String, String>> rows;
        try {
            rows = CsvTableReader.read(rulesFile);
        } catch (IOException e) {
            log.error("Unable to read tag rules from {}, falling back to a single {} tag",
                    rulesFile, FALLBACK_RULE.name(), e);
            return TagRuleRegistry.of(List.of(FALLBACK_RULE));
        }
        log.info("Read {} rows from {}", rows.size(), rulesFile);

        List<TagRule> rules = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String main = CsvTableReader.value(row, "Hovedkategori", "hovedkategori", "main_category");
            String sub = CsvTableReader.value(row, "Underkategori", "underkategori", "sub_category");
            if (main.isEmpty()) {
                log.warn("Row {}: no main category, available columns {}", i, row.keySet());
                continue;
            }
            String description = CsvTableReader.value(row, "Beskrivelse", "beskrivelse", "description");
            String examples = CsvTableReader.value(row, "Relevante tilbudseksempler", "eksempler", "examples");

            String name = TagNames.normalize(sub.isEmpty() ? main : sub);
            rules.add(new TagRule(name, main, sub, description, splitExamples(examples)));
            log.debug("Created tag {}", name);
        }

        TagRuleRegistry registry = TagRuleRegistry.of(rules);
        if (registry.isEmpty()) {
            log.warn("No usable rows in {}, falling back to a single {} tag", rulesFile, FALLBACK_RULE.name());
            return TagRuleRegistry.of(List.of(FALLBACK_RULE));
        }
        log.info("Loaded {} tags from {}", registry.size(), rulesFile);
        return registry;
    }

    private static List<String> splitExamples(String examples) {
        if (examples.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(examples.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
