package com.example.tagging.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagRuleRegistryTest {

    @Test
    @DisplayName("keeps rules file order and replaces duplicates in place")
    void keepsOrder() {
        TagRuleRegistry registry = TagRuleRegistry.of(List.of(
                new TagRule("SPORT", "Fritid", "Sport", "old", List.of()),
                new TagRule("MUSIK", "Kultur", "Musik", "", List.of()),
                new TagRule("SPORT", "Fritid", "Sport", "new", List.of("Fodbold"))));

        assertThat(registry.tagNameList()).containsExactly("SPORT", "MUSIK");
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.rule("SPORT")).get()
                .extracting(TagRule::description)
                .isEqualTo("new");
    }

    @Test
    void ofNamesNormalizes() {
        TagRuleRegistry registry = TagRuleRegistry.ofNames("byggeri og anlæg", "IT-sikkerhed");

        assertThat(registry.tagNames()).containsExactly("BYGGERI_OG_ANLÆG", "IT_SIKKERHED");
        assertThat(registry.contains("IT_SIKKERHED")).isTrue();
        assertThat(registry.contains("it-sikkerhed")).isFalse();
        assertThat(registry.contains(null)).isFalse();
    }

    @Test
    void isReadOnly() {
        TagRuleRegistry registry = TagRuleRegistry.ofNames("A");

        assertThatThrownBy(() -> registry.tagNames().add("B"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> registry.tagNameList().add("B"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(registry.rule("B")).isEmpty();
    }

    @Test
    void displayNameCombinesCategories() {
        assertThat(new TagRule("SPORT", "Fritid", "Sport", "", null).displayName()).isEqualTo("Fritid - Sport");
        assertThat(new TagRule("FRITID", "Fritid", "", "", null).displayName()).isEqualTo("Fritid");
    }

    @Test
    void normalizeHandlesSeparatorsAndBlanks() {
        assertThat(TagNames.normalize("  ledelse/strategi ")).isEqualTo("LEDELSE_STRATEGI");
        assertThat(TagNames.normalize("e-learning")).isEqualTo("E_LEARNING");
        assertThat(TagNames.normalize("   ")).isNull();
        assertThat(TagNames.normalize(null)).isNull();
    }
}
