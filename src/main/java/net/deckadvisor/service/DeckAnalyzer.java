package net.deckadvisor.service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.ResilientCatalogClient;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.Deck;
import net.deckadvisor.model.DeckEntry;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.model.SynergyTheme;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link DeckProfile} from a deck's mainboard.
 *
 * <p>Each distinct card name is resolved once through the catalog. When the catalog does not
 * know the card, or cannot be reached, the entry's stored card data is used instead.</p>
 */
@Component
@Slf4j
public class DeckAnalyzer {

    private final CatalogClient catalogClient;
    private final KeywordExtractor keywordExtractor;
    private final List<SynergyTheme> themes;

    @Autowired
    public DeckAnalyzer(CatalogClient catalogClient, KeywordExtractor keywordExtractor) {
        this(catalogClient, keywordExtractor, SynergyThemes.defaults());
    }

    public DeckAnalyzer(CatalogClient catalogClient, KeywordExtractor keywordExtractor, List<SynergyTheme> themes) {
        this.catalogClient = ResilientCatalogClient.wrap(catalogClient);
        this.keywordExtractor = keywordExtractor;
        this.themes = List.copyOf(themes);
    }

    public DeckProfile analyze(Deck deck) {
        if (deck == null || deck.isEmpty()) {
            return DeckProfile.empty();
        }
        Map<String, Integer> colors = new LinkedHashMap<>();
        Map<Integer, Integer> manaValues = new HashMap<>();
        Map<String, Integer> types = new LinkedHashMap<>();
        Map<String, Integer> keywords = new LinkedHashMap<>();
        Map<String, Integer> themeCounts = new LinkedHashMap<>();
        Map<String, Card> resolved = new HashMap<>();
        int total = 0;

        for (DeckEntry entry : deck.mainboard()) {
            int quantity = entry.quantity();
            if (quantity == 0) {
                continue;
            }
            Card card = resolved.computeIfAbsent(entry.name().toLowerCase(Locale.ROOT), key -> resolve(entry));
            total += quantity;
            card.colors().forEach(color -> colors.merge(color, quantity, Integer::sum));
            manaValues.merge(card.manaValueBucket(), quantity, Integer::sum);
            types.merge(card.primaryType(), quantity, Integer::sum);
            keywordExtractor.extract(card.oracleText())
                .forEach(tag -> keywords.merge(tag, quantity, Integer::sum));
            String searchable = card.typeLine() + "\n" + card.oracleText();
            for (SynergyTheme theme : themes) {
                if (keywordExtractor.matchesAny(searchable, theme.terms())) {
                    themeCounts.merge(theme.name(), quantity, Integer::sum);
                }
            }
        }

        log.debug("Analyzed deck '{}': {} mainboard cards, {} distinct", deck.getName(), total, resolved.size());
        return new DeckProfile(colors, manaValues, types, keywords, themeCounts, total);
    }

    private Card resolve(DeckEntry entry) {
        return catalogClient.lookupByName(entry.name()).orElseGet(() -> {
            log.debug("Catalog has no data for '{}'; using stored card data", entry.name());
            return entry.card();
        });
    }
}
