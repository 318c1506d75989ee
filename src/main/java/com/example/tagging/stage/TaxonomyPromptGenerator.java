package com.example.tagging.stage;

import com.example.tagging.model.EventRecord;
import com.example.tagging.model.PromptPayload;
import com.example.tagging.registry.TagRule;
import com.example.tagging.registry.TagRuleRegistry;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the tagging prompt: the event, the allowed tags with their descriptions, and the answer format.
 */
@Service
public class TaxonomyPromptGenerator implements PromptGenerator {

    private static final int MAX_DESCRIPTION_CHARS = 4000;

    private static final String ANSWER_FORMAT = """
            Answer with a single JSON object and nothing else:
            {"TAG1": "<most likely tag>", "TAG2": "<second tag or null>", "TAG3": "<third tag or null>",
             "CONFIDENCE": <number between 0 and 1>, "REASONING": "<one or two sentences>"}
            Use only tag names from the list above, written exactly as listed.
            """;

    private final TagRuleRegistry registry;

    public TaxonomyPromptGenerator(TagRuleRegistry registry) {
        this.registry = registry;
    }

    @Override
    public PromptPayload generate(EventRecord event, List<String> availableTags) {
        String tags = availableTags.stream()
                .map(this::describe)
                .collect(Collectors.joining("\n"));

        String prompt = """
                Assign up to three tags to the event below, most likely first.

                EVENT:
                %s

                AVAILABLE TAGS:
                %s

                %s""".formatted(formatEvent(event), tags, ANSWER_FORMAT);
        return new PromptPayload(prompt.strip(), availableTags);
    }

    private String describe(String tag) {
        Optional<TagRule> rule = registry.rule(tag);
        if (rule.isEmpty() || rule.get().description().isBlank()) {
            return "- " + tag;
        }
        TagRule r = rule.get();
        String line = "- " + tag + " (" + r.displayName() + "): " + r.description();
        if (!r.examples().isEmpty()) {
            line += " Examples: " + String.join(", ", r.examples());
        }
        return line;
    }

    static String formatEvent(EventRecord event) {
        StringBuilder sb = new StringBuilder();
        sb.append("Title: ").append(event.title()).append('\n');
        sb.append("Organizer: ").append(orDefault(event.organizer())).append('\n');
        sb.append("Type: ").append(orDefault(event.subtype())).append('\n');
        if (notBlank(event.teaser())) {
            sb.append("Teaser: ").append(event.teaser()).append('\n');
        }
        String description = notBlank(event.plainDescription()) ? event.plainDescription() : event.description();
        if (notBlank(description)) {
            sb.append("Description: ").append(truncate(description)).append('\n');
        } else if (!notBlank(event.teaser())) {
            sb.append("Description: not available\n");
        }
        return sb.toString().strip();
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_DESCRIPTION_CHARS) return text;
        return text.substring(0, MAX_DESCRIPTION_CHARS) + " [...]";
    }

    private static String orDefault(String value) {
        return notBlank(value) ? value : "not specified";
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
