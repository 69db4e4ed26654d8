package net.deckadvisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import net.deckadvisor.model.Card;

/**
 * One deck list line as submitted by clients. Only the name is required; the remaining fields
 * are the stored card data used when the catalog cannot resolve the name.
 */
public record DeckCardRequest(
    String name,
    Integer quantity,
    Boolean sideboard,
    @JsonProperty("mana_cost") String manaCost,
    @JsonProperty("mana_value") Double manaValue,
    @JsonProperty("type_line") String typeLine,
    List<String> colors,
    String rarity,
    @JsonProperty("oracle_text") String oracleText,
    String power,
    String toughness,
    Map<String, String> legalities
) {
    public int quantityOrDefault() {
        return quantity == null ? 1 : quantity;
    }

    public boolean isSideboard() {
        return Boolean.TRUE.equals(sideboard);
    }

    public Card toCard() {
        return Card.builder()
            .name(name)
            .manaCost(manaCost)
            .manaValue(manaValue == null ? 0d : manaValue)
            .typeLine(typeLine)
            .colors(colors)
            .rarity(rarity)
            .oracleText(oracleText)
            .power(power)
            .toughness(toughness)
            .legalities(legalities)
            .build();
    }
}
