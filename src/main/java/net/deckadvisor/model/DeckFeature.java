package net.deckadvisor.model;

/**
 * Feature flags an archetype expects, each backed by a keyword category.
 */
public enum DeckFeature {
    BURN_SPELLS("burn"),
    COUNTERSPELLS("counter"),
    BOARD_WIPES("board wipe"),
    TUTORING("tutor");

    private final String keywordTag;

    DeckFeature(String keywordTag) {
        this.keywordTag = keywordTag;
    }

    public String getKeywordTag() {
        return keywordTag;
    }
}
