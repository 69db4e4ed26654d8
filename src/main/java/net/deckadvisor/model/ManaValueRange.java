package net.deckadvisor.model;

/**
 * Inclusive mana value interval.
 */
public record ManaValueRange(int min, int max) {

    public boolean contains(double manaValue) {
        return manaValue >= min && manaValue <= max;
    }
}
