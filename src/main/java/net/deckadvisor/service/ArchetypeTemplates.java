package net.deckadvisor.service;

import java.util.List;
import java.util.Set;
import net.deckadvisor.model.ArchetypeTemplate;
import net.deckadvisor.model.CreatureRatioBound;
import net.deckadvisor.model.DeckFeature;
import net.deckadvisor.model.ManaValueRange;

/**
 * The built-in archetype templates. List order is the classifier's tie-break order.
 */
public final class ArchetypeTemplates {

    public static final String AGGRO = "aggro";
    public static final String CONTROL = "control";
    public static final String MIDRANGE = "midrange";
    public static final String COMBO = "combo";
    public static final String RAMP = "ramp";

    private static final List<ArchetypeTemplate> DEFAULTS = List.of(
        new ArchetypeTemplate(AGGRO,
            List.of("haste", "double strike", "first strike", "trample", "menace", "prowess"),
            new ManaValueRange(1, 3),
            CreatureRatioBound.atLeast(0.5),
            Set.of(DeckFeature.BURN_SPELLS)),
        new ArchetypeTemplate(CONTROL,
            List.of("flash", "hexproof", "ward", "vigilance", "lifelink"),
            new ManaValueRange(2, 6),
            CreatureRatioBound.atMost(0.3),
            Set.of(DeckFeature.COUNTERSPELLS, DeckFeature.BOARD_WIPES)),
        new ArchetypeTemplate(MIDRANGE,
            List.of("flying", "deathtouch", "lifelink", "vigilance", "reach"),
            new ManaValueRange(2, 5),
            CreatureRatioBound.between(0.3, 0.6),
            Set.of()),
        new ArchetypeTemplate(COMBO,
            List.of("enters", "activated ability", "triggered ability", "sacrifice"),
            null,
            null,
            Set.of(DeckFeature.TUTORING)),
        new ArchetypeTemplate(RAMP,
            List.of("reach", "flying", "trample"),
            new ManaValueRange(1, 8),
            null,
            Set.of())
    );

    private ArchetypeTemplates() {
    }

    public static List<ArchetypeTemplate> defaults() {
        return DEFAULTS;
    }
}
