package com.example.tagging.stage;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks the title, rejects events mentioning sensitive keywords and strips HTML from the text fields.
 */
@Service
public class DefaultInputValidator implements InputValidator {

    private static final Logger log = LoggerFactory.getLogger(DefaultInputValidator.class);

    static final int MIN_TITLE_LENGTH = 3;

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<String> sensitiveKeywords;

    @Autowired
    public DefaultInputValidator(TaggingProperties properties) {
        this(properties.sensitiveKeywords());
    }

    public DefaultInputValidator(List<String> sensitiveKeywords) {
        this.sensitiveKeywords = sensitiveKeywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public EventRecord validate(EventRecord event) {
        if (event == null) {
            throw new ValidationException("Event is missing");
        }
        String title = clean(event.title());
        if (title == null || title.length() < MIN_TITLE_LENGTH) {
            throw new ValidationException("Title must be at least " + MIN_TITLE_LENGTH + " characters");
        }

        EventRecord cleaned = event.withText(title, clean(event.teaser()),
                clean(event.description()), clean(event.plainDescription()));

        if (!cleaned.hasDescription()) {
            log.warn("No description available for event '{}'", title);
        }

        String keyword = findSensitiveKeyword(cleaned);
        if (keyword != null) {
            log.warn("Sensitive keyword '{}' in event '{}'", keyword, title);
            throw new ValidationException("Event contains sensitive content: " + keyword);
        }
        return cleaned;
    }

    private String findSensitiveKeyword(EventRecord event) {
        String text = Stream.of(event.title(), event.teaser(), event.description(), event.plainDescription())
                .filter(s -> s != null)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
        for (String keyword : sensitiveKeywords) {
            if (text.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    /** Removes tags and common entities and collapses whitespace. Null stays null. */
    static String clean(String text) {
        if (text == null) {
            return null;
        }
        String s = HTML_TAG.matcher(text).replaceAll(" ");
        s = s.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
        return WHITESPACE.matcher(s).replaceAll(" ").strip();
    }
}
