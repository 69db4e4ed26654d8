package net.deckadvisor.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.Collections;
import net.deckadvisor.exception.ArchetypeConfigurationException;

/**
 * Static description of a deck strategy used as a classification target.
 * Validated on construction; a malformed template fails immediately.
 *
 * @param name lower-case archetype label
 * @param keywords keyword tags the archetype relies on, most characteristic first
 * @param manaValueRange expected mana values, or null when unconstrained
 * @param creatureRatioBound expected creature share, or null when unconstrained
 * @param features keyword categories whose presence supports this archetype
 */
public record ArchetypeTemplate(
    String name,
    List<String> keywords,
    ManaValueRange manaValueRange,
    CreatureRatioBound creatureRatioBound,
    Set<DeckFeature> features
) {
    public ArchetypeTemplate {
        if (name == null || name.isBlank()) {
            throw new ArchetypeConfigurationException(String.valueOf(name), "name must not be blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
        if (keywords == null || keywords.isEmpty()) {
            throw new ArchetypeConfigurationException(name, "at least one keyword is required");
        }
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                throw new ArchetypeConfigurationException(name, "keywords must not be blank");
            }
        }
        keywords = List.copyOf(keywords);
        if (manaValueRange != null
                && (manaValueRange.min() < 0 || manaValueRange.min() > manaValueRange.max())) {
            throw new ArchetypeConfigurationException(name, "mana value range " + manaValueRange + " is inverted or negative");
        }
        if (creatureRatioBound != null) {
            validateBound(name, creatureRatioBound);
        }
        features = features == null || features.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(features));
    }

    private static void validateBound(String name, CreatureRatioBound bound) {
        if (bound.kind() == null) {
            throw new ArchetypeConfigurationException(name, "creature ratio bound needs a kind");
        }
        if (bound.lower() < 0 || bound.upper() > 1 || bound.lower() > bound.upper()) {
            throw new ArchetypeConfigurationException(name,
                "creature ratio bound [" + bound.lower() + ", " + bound.upper() + "] must lie within [0, 1]");
        }
    }
}
