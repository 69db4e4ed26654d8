package net.deckadvisor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Winning archetype label plus every template's score, in template order.
 */
public record ArchetypeClassification(String archetype, Map<String, Double> scores) {

    public ArchetypeClassification {
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public double scoreOf(String archetypeName) {
        return scores.getOrDefault(archetypeName, 0d);
    }
}
