package net.deckadvisor.controller.dto;

import java.util.List;
import net.deckadvisor.model.Deck;

/**
 * Deck payload. Lines naming the same card on the same board are merged.
 */
public record DeckRequest(String name, String format, List<DeckCardRequest> cards) {

    public DeckRequest {
        cards = cards == null ? List.of() : List.copyOf(cards);
    }

    public Deck toDeck() {
        Deck deck = new Deck(name, format);
        for (DeckCardRequest card : cards) {
            if (card == null || card.name() == null || card.name().isBlank()) {
                throw new IllegalArgumentException("Every deck card needs a name");
            }
            deck.addCard(card.toCard(), card.quantityOrDefault(), card.isSideboard());
        }
        return deck;
    }
}
