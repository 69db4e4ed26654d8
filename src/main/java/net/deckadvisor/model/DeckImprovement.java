package net.deckadvisor.model;

/**
 * A general piece of deck-building advice, independent of any specific card.
 *
 * @param kind rule that produced the advice
 * @param message human-readable suggestion
 */
public record DeckImprovement(Kind kind, String message) {

    public enum Kind {
        DECK_SIZE,
        EARLY_GAME,
        LATE_GAME,
        TOO_MANY_COLORS,
        UNFOCUSED
    }
}
