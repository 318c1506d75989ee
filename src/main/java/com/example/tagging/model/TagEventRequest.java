package com.example.tagging.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tagging request body, using the field names of the event export.
 * {@code arrangor} is accepted in place of {@code arrangør}.
 */
public record TagEventRequest(
        @JsonProperty("arrangement_nummer") String arrangementNummer,
        @JsonProperty("arrangement_titel") String arrangementTitel,
        @JsonProperty("arrangør") @JsonAlias("arrangor") String arrangoer,
        @JsonProperty("arrangement_undertype") String arrangementUndertype,
        @JsonProperty("nc_teaser") String ncTeaser,
        @JsonProperty("nc_beskrivelse") String ncBeskrivelse,
        @JsonProperty("beskrivelse_html_fri") String beskrivelseHtmlFri,
        @JsonProperty("include_reasoning") Boolean includeReasoning,
        @JsonProperty("require_confidence") Boolean requireConfidence
) {

    public EventRecord toEventRecord() {
        return new EventRecord(arrangementNummer, arrangementTitel, arrangoer, arrangementUndertype,
                ncTeaser, ncBeskrivelse, beskrivelseHtmlFri);
    }

    public boolean reasoningRequested() {
        return includeReasoning == null || includeReasoning;
    }

    public boolean confidenceRequested() {
        return requireConfidence == null || requireConfidence;
    }
}
