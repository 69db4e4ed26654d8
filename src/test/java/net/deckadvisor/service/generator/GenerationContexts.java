package net.deckadvisor.service.generator;

import net.deckadvisor.catalog.LocalCatalogClient;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.service.ArchetypeClassifier;
import net.deckadvisor.service.DeckAnalyzer;
import net.deckadvisor.service.KeywordExtractor;
import net.deckadvisor.support.TestCards;

/**
 * Builds generator inputs from a deck the same way the pipeline does, using the deck's stored card data.
 */
final class GenerationContexts {

    private GenerationContexts() {
    }

    static GenerationContext forDeck(Deck deck, int targetCount, RecommendationProperties properties) {
        DeckProfile profile = new DeckAnalyzer(LocalCatalogClient.of(), new KeywordExtractor()).analyze(deck);
        ArchetypeClassifier classifier = new ArchetypeClassifier(properties);
        ArchetypeClassification classification = classifier.classify(profile);
        return new GenerationContext(
            profile,
            classification,
            classifier.template(classification.archetype()).orElse(null),
            deck.mainboardNames(),
            profile.colorIdentity(),
            deck.getFormat(),
            targetCount);
    }

    static Deck burnDeck() {
        Deck deck = new Deck("Mono Red Burn", "standard");
        for (int i = 1; i <= 5; i++) {
            deck.addCard(TestCards.bolt("Bolt " + i), 4);
        }
        return deck.addCard(TestCards.basicLand("Mountain", "R"), 20);
    }
}
