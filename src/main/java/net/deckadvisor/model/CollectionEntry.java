package net.deckadvisor.model;

/**
 * Owned copies of one card.
 */
public record CollectionEntry(String name, int regular, int foil) {

    public CollectionEntry {
        regular = Math.max(0, regular);
        foil = Math.max(0, foil);
    }

    public int total() {
        return regular + foil;
    }
}
