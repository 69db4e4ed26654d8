package net.deckadvisor.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.model.Card;

/**
 * Maps Scryfall card objects to {@link Card}.
 *
 * <p>Multi-faced cards (transform, modal double-faced, adventure, split) are represented by their
 * front face: name, cost, type line, rules text and stats come from {@code card_faces[0]},
 * falling back to the top-level field when the face lacks it.</p>
 */
@Slf4j
public final class ScryfallCardMapper {

    private ScryfallCardMapper() {
    }

    /**
     * @return the mapped card, or empty when the node is not a card object or has no name
     */
    public static Optional<Card> map(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode front = frontFace(node);
        String name = faceText(node, front, "name");
        if (name == null || name.isBlank()) {
            log.debug("Skipping catalog object without a name: {}", text(node, "id"));
            return Optional.empty();
        }
        return Optional.of(Card.builder()
            .name(name)
            .manaCost(faceText(node, front, "mana_cost"))
            .manaValue(node.path("cmc").asDouble(0d))
            .typeLine(faceText(node, front, "type_line"))
            .colors(colors(node, front))
            .rarity(text(node, "rarity"))
            .oracleText(faceText(node, front, "oracle_text"))
            .power(faceText(node, front, "power"))
            .toughness(faceText(node, front, "toughness"))
            .legalities(legalities(node.get("legalities")))
            .setCode(text(node, "set"))
            .collectorNumber(text(node, "collector_number"))
            .build());
    }

    /**
     * Maps every card in a Scryfall list object's {@code data} array, skipping unmappable entries.
     */
    public static List<Card> mapList(JsonNode listNode) {
        JsonNode data = listNode == null ? null : listNode.get("data");
        if (data == null || !data.isArray()) {
            return List.of();
        }
        List<Card> cards = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            map(item).ifPresent(cards::add);
        }
        return cards;
    }

    private static JsonNode frontFace(JsonNode node) {
        JsonNode faces = node.get("card_faces");
        if (faces != null && faces.isArray() && faces.size() > 0 && faces.get(0).isObject()) {
            return faces.get(0);
        }
        return node;
    }

    private static String faceText(JsonNode node, JsonNode front, String field) {
        String value = text(front, field);
        return value != null ? value : text(node, field);
    }

    private static List<String> colors(JsonNode node, JsonNode front) {
        JsonNode colors = node.get("colors");
        if (colors == null || !colors.isArray()) {
            colors = front.get("colors");
        }
        if (colors == null || !colors.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>(colors.size());
        colors.forEach(color -> result.add(color.asText()));
        return result;
    }

    private static Map<String, String> legalities(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, String> result = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> result.put(entry.getKey(), entry.getValue().asText()));
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
