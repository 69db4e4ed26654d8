package net.deckadvisor.model;

/**
 * One line of a deck list.
 *
 * @param card stored card data, used when the catalog cannot resolve the name
 * @param quantity copies, never negative
 * @param sideboard whether the entry belongs to the sideboard
 */
public record DeckEntry(Card card, int quantity, boolean sideboard) {

    public DeckEntry {
        if (card == null) {
            throw new IllegalArgumentException("Deck entry requires a card");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity must not be negative for " + card.name());
        }
    }

    public String name() {
        return card.name();
    }

    DeckEntry withQuantity(int newQuantity) {
        return new DeckEntry(card, newQuantity, sideboard);
    }
}
