package net.deckadvisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.DeckImprovement;
import net.deckadvisor.model.DeckProfile;

/**
 * Deck profile, archetype classification and general improvement advice.
 */
public record DeckAnalysisResponse(
    @JsonProperty("total_cards") int totalCards,
    Map<String, Integer> colors,
    @JsonProperty("mana_values") Map<Integer, Integer> manaValues,
    Map<String, Integer> types,
    Map<String, Integer> keywords,
    Map<String, Integer> themes,
    @JsonProperty("creature_ratio") double creatureRatio,
    @JsonProperty("land_count") int landCount,
    @JsonProperty("spell_count") int spellCount,
    String archetype,
    @JsonProperty("archetype_scores") Map<String, Double> archetypeScores,
    List<DeckImprovement> improvements
) {
    public static DeckAnalysisResponse from(DeckProfile profile,
                                            ArchetypeClassification classification,
                                            List<DeckImprovement> improvements) {
        return new DeckAnalysisResponse(
            profile.totalCards(),
            profile.colors(),
            profile.manaValues(),
            profile.types(),
            profile.keywords(),
            profile.themes(),
            profile.creatureRatio(),
            profile.landCount(),
            profile.spellCount(),
            classification.archetype(),
            classification.scores(),
            improvements);
    }
}
