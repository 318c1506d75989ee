package com.example.tagging.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TagRuleLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsSemicolonSeparatedRules() throws IOException {
        Path file = write("\uFEFF" + """
                Hovedkategori;Underkategori;Beskrivelse;Relevante tilbudseksempler
                Teknik;Byggeri og anlæg;Kurser om byggeri;Murerkursus, Stilladskursus
                Kultur;;Kulturelle arrangementer;
                """);

        TagRuleRegistry registry = TagRuleLoader.load(file);

        assertThat(registry.tagNameList()).containsExactly("BYGGERI_OG_ANLÆG", "KULTUR");
        TagRule rule = registry.rule("BYGGERI_OG_ANLÆG").orElseThrow();
        assertThat(rule.mainCategory()).isEqualTo("Teknik");
        assertThat(rule.description()).isEqualTo("Kurser om byggeri");
        assertThat(rule.examples()).containsExactly("Murerkursus", "Stilladskursus");
        assertThat(registry.rule("KULTUR").orElseThrow().examples()).isEmpty();
    }

    @Test
    void acceptsCommaSeparatedEnglishColumns() throws IOException {
        Path file = write("""
                main_category,sub_category,description,examples
                Health,Mental health,Wellbeing,"Stress, Sleep"
                """);

        TagRuleRegistry registry = TagRuleLoader.load(file);

        assertThat(registry.tagNameList()).containsExactly("MENTAL_HEALTH");
        assertThat(registry.rule("MENTAL_HEALTH").orElseThrow().examples()).containsExactly("Stress", "Sleep");
    }

    @Test
    void unquotedSeparatorInOneRowSkipsOnlyThatRow() throws IOException {
        Path file = write("""
                Hovedkategori;Underkategori;Beskrivelse
                Sport;Fodbold;Boldspil
                Musik;Rock;Guitar; bas og trommer
                Mad;Madlavning;Kurser i køkkenet
                """);

        assertThat(TagRuleLoader.load(file).tagNameList()).containsExactly("FODBOLD", "MADLAVNING");
    }

    @Test
    void missingFileFallsBackToGeneral() {
        TagRuleRegistry registry = TagRuleLoader.load(dir.resolve("nope.csv"));

        assertThat(registry.tagNameList()).containsExactly("GENERAL");
    }

    @Test
    void fileWithoutUsableRowsFallsBackToGeneral() throws IOException {
        Path file = write("""
                Hovedkategori;Underkategori
                ;Orphan
                """);

        assertThat(TagRuleLoader.load(file).tagNameList()).containsExactly(TagRuleLoader.FALLBACK_RULE.name());
    }

    private Path write(String content) throws IOException {
        Path file = dir.resolve("tagsregler.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
