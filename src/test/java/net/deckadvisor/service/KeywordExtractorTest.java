package net.deckadvisor.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class KeywordExtractorTest {

    private final KeywordExtractor extractor = new KeywordExtractor();

    @Test
    void should_ReturnTagsInTableOrder() {
        List<String> tags = extractor.extract("Flying, haste\nWhen this enters, draw a card.");

        assertThat(tags).containsExactly("haste", "flying", "card draw", "enters");
    }

    @ParameterizedTest
    @CsvSource({
        "'Lightning Bolt deals 3 damage to any target.', burn",
        "'Counter target spell.', counter",
        "'Destroy all creatures.', board wipe",
        "'Search your library for a card, put that card into your hand.', tutor",
        "'Exile target creature.', removal",
        "'You gain 3 life.', lifegain"
    })
    void should_DetectCategoryTags(String text, String tag) {
        assertThat(extractor.extract(text)).contains(tag);
    }

    @Test
    void should_MatchWholeWordsOnly() {
        assertThat(extractor.extract("Reward your opponent.")).doesNotContain("ward");
        assertThat(extractor.extract("Flashback {2}{R}")).contains("flashback").doesNotContain("flash");
    }

    @Test
    void should_ReturnEmpty_When_TextBlank() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("  ")).isEmpty();
    }

    @Test
    void should_MatchTermsAtWordStart() {
        assertThat(extractor.matchesAny("Creature — Elf Warrior", List.of("elf"))).isTrue();
        assertThat(extractor.matchesAny("Artifacts you control", List.of("artifact"))).isTrue();
        assertThat(extractor.matchesAny("Creature — Shelf Golem", List.of("elf"))).isFalse();
        assertThat(extractor.matchesAny(null, List.of("elf"))).isFalse();
    }

    @Test
    void should_ExposeEveryTag() {
        assertThat(KeywordExtractor.knownTags())
            .contains("burn", "counter", "board wipe", "tutor", "activated ability", "triggered ability")
            .hasSize(29);
    }

    @Test
    void should_DetectPluralArtifactsAndAbilityWording() {
        assertThat(extractor.extract("Artifacts you control have hexproof.")).contains("artifact", "hexproof");
        assertThat(extractor.extract("Activated abilities of creatures cost {1} more to activate."))
            .contains("activated ability");
        assertThat(extractor.extract("Copy target triggered ability you control.")).contains("triggered ability");
    }
}
