package com.example.tagging.stage;

import com.example.tagging.model.ParsedTagResult;
import com.example.tagging.registry.TagNames;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the model answer as a JSON object with {@code TAG1..TAG3}, {@code CONFIDENCE} and {@code REASONING}.
 * <p>
 * Tolerates what models commonly get wrong: markdown code fences, prose around the object,
 * trailing commas, comments, single quotes, lower-case keys and lower-case tag names.
 */
@Service
public class JsonOutputParser implements OutputParser {

    private static final Logger log = LoggerFactory.getLogger(JsonOutputParser.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build();

    @Override
    public ParsedTagResult parse(String content, Collection<String> availableTags) {
        if (content == null || content.isBlank()) {
            return ParsedTagResult.invalid("Empty model response");
        }

        JsonNode root;
        try {
            root = LENIENT_MAPPER.readTree(extractObject(content));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable model output: {}", e.getOriginalMessage());
            return ParsedTagResult.invalid("Could not parse JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ParsedTagResult.invalid("Model response is not a JSON object");
        }

        Map<String, JsonNode> fields = upperCaseFields(root);
        if (tagValue(fields.get("TAG1")) == null) {
            return ParsedTagResult.invalid("No valid TAG1 found in response");
        }

        List<String> tags = new ArrayList<>(3);
        for (int i = 1; i <= 3; i++) {
            JsonNode node = fields.get("TAG" + i);
            String tag = tagValue(node);
            if (tag == null) {
                continue;
            }
            if (!availableTags.contains(tag)) {
                return ParsedTagResult.invalid("TAG" + i + " = '" + node.asText() + "' is not an available tag");
            }
            if (!tags.contains(tag)) {
                tags.add(tag);
            }
        }

        double confidence;
        JsonNode confidenceNode = fields.get("CONFIDENCE");
        if (confidenceNode == null || confidenceNode.isNull()) {
            confidence = 0.0;
        } else if (confidenceNode.isNumber()) {
            confidence = confidenceNode.asDouble();
        } else {
            try {
                confidence = Double.parseDouble(confidenceNode.asText().strip());
            } catch (NumberFormatException e) {
                return ParsedTagResult.invalid("CONFIDENCE is not a number: '" + confidenceNode.asText() + "'");
            }
        }
        if (Double.isNaN(confidence) || Double.isInfinite(confidence)) {
            return ParsedTagResult.invalid("CONFIDENCE is not a finite number");
        }

        JsonNode reasoningNode = fields.get("REASONING");
        String reasoning = reasoningNode == null || reasoningNode.isNull() ? null : reasoningNode.asText();

        return ParsedTagResult.valid(tags.get(0),
                tags.size() > 1 ? tags.get(1) : null,
                tags.size() > 2 ? tags.get(2) : null,
                confidence, reasoning);
    }

    /** Normalized tag, or null for a missing, null or placeholder value. */
    private static String tagValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String tag = TagNames.normalize(node.asText());
        return tag == null || "NULL".equals(tag) || "NONE".equals(tag) ? null : tag;
    }

    /** Text between the first '{' and the last '}', or the stripped input when there is none. */
    static String extractObject(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return content.substring(start, end + 1);
        }
        return content.strip();
    }

    private static Map<String, JsonNode> upperCaseFields(JsonNode root) {
        Map<String, JsonNode> fields = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            fields.putIfAbsent(e.getKey().strip().toUpperCase(Locale.ROOT), e.getValue());
        }
        return fields;
    }
}
