package net.deckadvisor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Set;
import net.deckadvisor.catalog.LocalCatalogClient;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.exception.ArchetypeConfigurationException;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.ArchetypeTemplate;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.model.ManaValueRange;
import net.deckadvisor.support.TestCards;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArchetypeClassifierTest {

    private RecommendationProperties properties;
    private ArchetypeClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = RecommendationProperties.defaults();
        classifier = new ArchetypeClassifier(properties);
    }

    private static DeckProfile burnProfile() {
        Deck deck = new Deck("Burn", "modern");
        for (int i = 1; i <= 5; i++) {
            deck.addCard(TestCards.bolt("Bolt " + i), 4);
        }
        deck.addCard(TestCards.basicLand("Mountain", "R"), 20);
        return new DeckAnalyzer(LocalCatalogClient.of(), new KeywordExtractor()).analyze(deck);
    }

    @Test
    void should_ClassifyBurnDeckAsAggro() {
        ArchetypeClassification classification = classifier.classify(burnProfile());

        assertThat(classification.archetype()).isEqualTo(ArchetypeTemplates.AGGRO);
        assertThat(classification.scoreOf("aggro")).isEqualTo(0.3);
        assertThat(classification.scoreOf("control")).isEqualTo(0.2);
        assertThat(classification.scoreOf("ramp")).isEqualTo(0.15);
        assertThat(classification.scoreOf("midrange")).isZero();
        assertThat(classification.scores().keySet())
            .containsExactly("aggro", "control", "midrange", "combo", "ramp");
    }

    @Test
    void should_FallBackToMidrange_When_ProfileEmpty() {
        ArchetypeClassification classification = classifier.classify(DeckProfile.empty());

        assertThat(classification.archetype()).isEqualTo("midrange");
        assertThat(classification.scores().values()).containsOnly(0d);
    }

    @Test
    void should_FallBack_When_BestScoreBelowThreshold() {
        DeckProfile lands = new DeckProfile(Map.of(), Map.of(0, 40), Map.of("land", 40), Map.of(), Map.of(), 40);

        ArchetypeClassification classification = classifier.classify(lands);

        assertThat(classification.scoreOf("control")).isEqualTo(0.2);
        assertThat(classification.archetype()).isEqualTo("midrange");
    }

    @Test
    void should_PreferEarlierTemplate_When_ScoresTie() {
        List<ArchetypeTemplate> twins = List.of(
            new ArchetypeTemplate("alpha", List.of("haste"), new ManaValueRange(1, 3), null, Set.of()),
            new ArchetypeTemplate("beta", List.of("haste"), new ManaValueRange(1, 3), null, Set.of()));
        DeckProfile hasty = new DeckProfile(Map.of("R", 10), Map.of(1, 10), Map.of("creature", 10),
            Map.of("haste", 10), Map.of(), 10);

        ArchetypeClassification classification = new ArchetypeClassifier(twins, properties).classify(hasty);

        assertThat(classification.scoreOf("alpha")).isEqualTo(classification.scoreOf("beta")).isEqualTo(0.7);
        assertThat(classification.archetype()).isEqualTo("alpha");
    }

    @Test
    void should_CapKeywordContribution() {
        ArchetypeTemplate keywordsOnly = new ArchetypeTemplate("tempo", List.of("flash", "flying"), null, null, Set.of());
        DeckProfile profile = new DeckProfile(Map.of(), Map.of(2, 10), Map.of("creature", 10),
            Map.of("flash", 10, "flying", 10), Map.of(), 10);

        assertThat(classifier.score(keywordsOnly, profile)).isEqualTo(0.4);
    }

    @Test
    void should_RejectDuplicateOrMissingTemplates() {
        ArchetypeTemplate template = new ArchetypeTemplate("tempo", List.of("flash"), null, null, Set.of());

        assertThatThrownBy(() -> new ArchetypeClassifier(List.of(template, template), properties))
            .isInstanceOf(ArchetypeConfigurationException.class);
        assertThatThrownBy(() -> new ArchetypeClassifier(List.of(), properties))
            .isInstanceOf(ArchetypeConfigurationException.class);
    }

    @Test
    void should_RejectTemplateWithUnknownKeywordTag() {
        ArchetypeTemplate typo = new ArchetypeTemplate("tempo", List.of("flash", "flyng"), null, null, Set.of());

        assertThatThrownBy(() -> new ArchetypeClassifier(List.of(typo), properties))
            .isInstanceOf(ArchetypeConfigurationException.class)
            .hasMessageContaining("flyng");
    }

    @Test
    void should_LookUpTemplatesByName() {
        assertThat(classifier.template("control")).isPresent();
        assertThat(classifier.template("midrange")).map(ArchetypeTemplate::name).contains("midrange");
        assertThat(classifier.template("tribal")).isEmpty();
        assertThat(classifier.getTemplates()).hasSize(5);
    }
}
