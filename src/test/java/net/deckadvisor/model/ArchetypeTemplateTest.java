package net.deckadvisor.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import net.deckadvisor.exception.ArchetypeConfigurationException;
import org.junit.jupiter.api.Test;

class ArchetypeTemplateTest {

    @Test
    void should_LowerCaseName() {
        ArchetypeTemplate template = new ArchetypeTemplate("Tempo", List.of("flash"), new ManaValueRange(1, 3),
            CreatureRatioBound.atLeast(0.4), Set.of(DeckFeature.COUNTERSPELLS));

        assertThat(template.name()).isEqualTo("tempo");
        assertThat(template.features()).containsExactly(DeckFeature.COUNTERSPELLS);
    }

    @Test
    void should_Reject_When_KeywordsMissing() {
        assertThatThrownBy(() -> new ArchetypeTemplate("tempo", List.of(), null, null, null))
            .isInstanceOf(ArchetypeConfigurationException.class)
            .hasMessageContaining("tempo");
    }

    @Test
    void should_Reject_When_ManaValueRangeInverted() {
        assertThatThrownBy(() -> new ArchetypeTemplate("tempo", List.of("flash"), new ManaValueRange(4, 2), null, null))
            .isInstanceOf(ArchetypeConfigurationException.class);
    }

    @Test
    void should_Reject_When_CreatureRatioOutsideUnitInterval() {
        assertThatThrownBy(() -> new ArchetypeTemplate("tempo", List.of("flash"), null,
                CreatureRatioBound.between(0.6, 0.3), null))
            .isInstanceOf(ArchetypeConfigurationException.class);
        assertThatThrownBy(() -> new ArchetypeTemplate("tempo", List.of("flash"), null,
                CreatureRatioBound.atLeast(1.5), null))
            .isInstanceOf(ArchetypeConfigurationException.class);
    }

    @Test
    void should_EvaluateCreatureRatioBounds() {
        assertThat(CreatureRatioBound.atLeast(0.5).isSatisfiedBy(0.5)).isTrue();
        assertThat(CreatureRatioBound.atMost(0.3).isSatisfiedBy(0.31)).isFalse();
        assertThat(CreatureRatioBound.between(0.3, 0.6).isSatisfiedBy(0.45)).isTrue();
        assertThat(CreatureRatioBound.between(0.3, 0.6).prefersCreatures()).isEmpty();
        assertThat(CreatureRatioBound.atMost(0.3).prefersCreatures()).contains(false);
    }
}
