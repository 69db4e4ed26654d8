package net.deckadvisor.controller.dto;

import java.util.List;
import net.deckadvisor.model.CardCollection;

/**
 * Body of the one-shot and batch recommendation endpoints.
 *
 * @param deck deck to improve
 * @param collection owned cards; omit when unknown
 * @param count number of recommendations (one-shot) or increment (batch); defaults to 15
 * @param format target format; defaults to the deck's format
 */
public record RecommendationRequest(
    DeckRequest deck,
    List<CollectionCardRequest> collection,
    Integer count,
    String format
) {
    public static final int DEFAULT_COUNT = 15;

    public int countOrDefault() {
        return count == null ? DEFAULT_COUNT : count;
    }

    /**
     * @return the collection, or null when the request carries none
     */
    public CardCollection toCollection() {
        if (collection == null) {
            return null;
        }
        CardCollection cards = new CardCollection();
        for (CollectionCardRequest entry : collection) {
            if (entry == null || entry.name() == null || entry.name().isBlank()) {
                continue;
            }
            if (entry.regular() != null && entry.regular() > 0) {
                cards.addCard(entry.name(), entry.regular(), false);
            }
            if (entry.foil() != null && entry.foil() > 0) {
                cards.addCard(entry.name(), entry.foil(), true);
            }
        }
        return cards;
    }
}
