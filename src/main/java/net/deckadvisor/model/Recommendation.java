package net.deckadvisor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import net.deckadvisor.util.ScoreUtils;

/**
 * A suggested card addition. Scores are clamped into [0, 1] on every construction path;
 * enrichment steps return new instances.
 *
 * @param name card name
 * @param manaCost cost string
 * @param typeLine type line
 * @param rarity catalog rarity
 * @param manaValue numeric mana value
 * @param confidence overall ranking score
 * @param synergyScore fit with the deck's themes
 * @param metaScore popularity proxy
 * @param deckFitScore fit with the deck's archetype and curve
 * @param reasons human-readable explanations
 * @param ownership owned or craft status
 * @param legalities per-format legality, may be null
 * @param keywords keyword tags found in the card's rules text
 * @param oracleText rules text
 * @param powerToughness {@code P/T} display string for creatures
 * @param source strategy that produced the suggestion
 */
@Builder(toBuilder = true)
public record Recommendation(
    String name,
    @JsonProperty("mana_cost") String manaCost,
    @JsonProperty("type_line") String typeLine,
    String rarity,
    @JsonProperty("mana_value") double manaValue,
    double confidence,
    @JsonProperty("synergy_score") double synergyScore,
    @JsonProperty("meta_score") double metaScore,
    @JsonProperty("deck_fit_score") double deckFitScore,
    List<String> reasons,
    OwnershipStatus ownership,
    Map<String, String> legalities,
    List<String> keywords,
    @JsonProperty("oracle_text") String oracleText,
    @JsonProperty("power_toughness") String powerToughness,
    GeneratorKind source
) {
    public Recommendation {
        confidence = ScoreUtils.clampUnit(confidence);
        synergyScore = ScoreUtils.clampUnit(synergyScore);
        metaScore = ScoreUtils.clampUnit(metaScore);
        deckFitScore = ScoreUtils.clampUnit(deckFitScore);
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        legalities = legalities == null ? null : Map.copyOf(legalities);
        ownership = ownership == null ? OwnershipStatus.UNKNOWN : ownership;
    }

    public Recommendation withOwnership(OwnershipStatus status) {
        return toBuilder().ownership(status).build();
    }
}
