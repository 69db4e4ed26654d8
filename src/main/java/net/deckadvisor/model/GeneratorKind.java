package net.deckadvisor.model;

/**
 * Candidate generation strategies. Declaration order is the ranking priority when
 * two strategies suggest the same card.
 */
public enum GeneratorKind {
    FORMAT_STAPLES,
    ARCHETYPE_FIT,
    SYNERGY,
    CURVE_GAP
}
