package net.deckadvisor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.LocalCatalogClient;
import net.deckadvisor.exception.CatalogTransportException;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.support.TestCards;
import org.junit.jupiter.api.Test;

class DeckAnalyzerTest {

    private final KeywordExtractor keywordExtractor = new KeywordExtractor();

    @Test
    void should_BuildHistogramsThatSumToTotal() {
        Deck deck = new Deck("Gruul", "standard")
            .addCard(TestCards.bolt("Shock"), 4)
            .addCard(TestCards.creature("Ember Runner", "R", 2, "common", "Haste"), 4)
            .addCard(TestCards.creature("Wild Beast", "RG", 3, "uncommon", "Trample"), 2)
            .addCard(TestCards.basicLand("Mountain", "R"), 10)
            .addCard(TestCards.bolt("Lightning Bolt"), 2, true);
        DeckAnalyzer analyzer = new DeckAnalyzer(LocalCatalogClient.of(), keywordExtractor);

        DeckProfile profile = analyzer.analyze(deck);

        assertThat(profile.totalCards()).isEqualTo(20);
        assertThat(profile.manaValues().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(20);
        assertThat(profile.types().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(20);
        assertThat(profile.manaValues()).containsEntry(0, 10).containsEntry(1, 4).containsEntry(2, 4).containsEntry(3, 2);
        assertThat(profile.types()).containsEntry("instant", 4).containsEntry("creature", 6).containsEntry("land", 10);
        assertThat(profile.colors()).containsEntry("R", 10).containsEntry("G", 2);
        assertThat(profile.keywords()).containsEntry("burn", 4).containsEntry("haste", 4).containsEntry("trample", 2);
        assertThat(profile.colorIdentity()).containsExactly("R", "G");
        assertThat(profile.creatureRatio()).isEqualTo(0.3);
        assertThat(profile.spellCount()).isEqualTo(10);
    }

    @Test
    void should_PreferCatalogData_When_CardIsKnown() {
        Card stored = Card.named("Llanowar Elves");
        Deck deck = new Deck("Elves").addCard(stored, 4);
        DeckAnalyzer analyzer = new DeckAnalyzer(LocalCatalogClient.of(TestCards.elf("Llanowar Elves", 1)), keywordExtractor);

        DeckProfile profile = analyzer.analyze(deck);

        assertThat(profile.typeCount("creature")).isEqualTo(4);
        assertThat(profile.themes()).containsEntry("elf", 4);
    }

    @Test
    void should_FallBackToStoredCard_When_CatalogMissesOrFails() {
        CatalogClient catalog = mock(CatalogClient.class);
        when(catalog.lookupByName("Shock")).thenReturn(Optional.empty());
        when(catalog.lookupByName("Lightning Bolt"))
            .thenThrow(new CatalogTransportException("cards/named/exact", "Lightning Bolt", new RuntimeException("timeout")));
        Deck deck = new Deck("Burn")
            .addCard(TestCards.bolt("Shock"), 4)
            .addCard(TestCards.bolt("Lightning Bolt"), 4);

        DeckProfile profile = new DeckAnalyzer(catalog, keywordExtractor).analyze(deck);

        assertThat(profile.totalCards()).isEqualTo(8);
        assertThat(profile.keywordCount("burn")).isEqualTo(8);
        assertThat(profile.colors()).containsEntry("R", 8);
    }

    @Test
    void should_ResolveEachNameOnce() {
        CatalogClient catalog = mock(CatalogClient.class);
        when(catalog.lookupByName(anyString())).thenReturn(Optional.empty());
        Deck deck = new Deck("Burn")
            .addCard(TestCards.bolt("Shock"), 2)
            .addCard(TestCards.bolt("shock"), 2);

        DeckProfile profile = new DeckAnalyzer(catalog, keywordExtractor).analyze(deck);

        verify(catalog, times(1)).lookupByName(anyString());
        assertThat(profile.totalCards()).isEqualTo(4);
    }

    @Test
    void should_ReturnEmptyProfile_When_DeckEmptyOrOnlyZeroQuantities() {
        DeckAnalyzer analyzer = new DeckAnalyzer(LocalCatalogClient.of(), keywordExtractor);

        assertThat(analyzer.analyze(new Deck("Empty")).isEmpty()).isTrue();
        assertThat(analyzer.analyze(new Deck("Zero").addCard(TestCards.bolt("Shock"), 0)).isEmpty()).isTrue();
        assertThat(analyzer.analyze(null)).isEqualTo(DeckProfile.empty());
    }

    @Test
    void should_CountThemesFromTypeLineAndRulesText() {
        Deck deck = new Deck("Artifacts")
            .addCard(TestCards.spell("Tinker Up", "U", 2, "common", "Improvise. Draw a card for each artifact you control."), 3)
            .addCard(Card.builder().name("Steel Golem").typeLine("Artifact Creature — Golem").manaValue(3).build(), 2);

        DeckProfile profile = new DeckAnalyzer(LocalCatalogClient.of(), keywordExtractor, SynergyThemes.defaults())
            .analyze(deck);

        assertThat(profile.themes()).containsEntry("artifacts", 5);
        assertThat(List.copyOf(profile.themes().keySet())).doesNotContain("elf");
    }
}
