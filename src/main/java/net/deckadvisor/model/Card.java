package net.deckadvisor.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import net.deckadvisor.util.ManaColors;

/**
 * Canonical card metadata as resolved from the catalog or carried on a deck entry.
 *
 * @param name card name, unique across printings
 * @param manaCost cost string such as {@code {1}{R}}
 * @param manaValue numeric total cost
 * @param typeLine full type line, e.g. {@code Legendary Creature — Elf Druid}
 * @param colors colour symbols in WUBRG order
 * @param rarity catalog rarity string
 * @param oracleText rules text, empty when absent
 * @param power printed power, null for non-creatures
 * @param toughness printed toughness, null for non-creatures
 * @param legalities format name to legality ({@code legal}, {@code not_legal}, {@code banned}, ...)
 * @param setCode set code of the printing, display only
 * @param collectorNumber collector number of the printing, display only
 */
@Builder(toBuilder = true)
public record Card(
    String name,
    String manaCost,
    double manaValue,
    String typeLine,
    List<String> colors,
    String rarity,
    String oracleText,
    String power,
    String toughness,
    Map<String, String> legalities,
    String setCode,
    String collectorNumber
) {
    private static final List<String> SUPERTYPES = List.of("basic", "legendary", "snow", "world");

    public Card {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Card name must not be blank");
        }
        name = name.trim();
        manaCost = manaCost == null ? "" : manaCost;
        manaValue = Double.isNaN(manaValue) || manaValue < 0 ? 0d : manaValue;
        typeLine = typeLine == null ? "" : typeLine;
        colors = ManaColors.normalize(colors);
        oracleText = oracleText == null ? "" : oracleText;
        legalities = legalities == null ? null : Map.copyOf(legalities);
    }

    public static Card named(String name) {
        return Card.builder().name(name).build();
    }

    public boolean isCreature() {
        return typeLine.toLowerCase(Locale.ROOT).contains("creature");
    }

    public boolean isBasicLand() {
        String lower = typeLine.toLowerCase(Locale.ROOT);
        return lower.contains("basic") && lower.contains("land");
    }

    /**
     * First word of the type line after dropping supertypes, lower-cased; {@code "unknown"} when absent.
     */
    public String primaryType() {
        String front = typeLine.split("[—-]", 2)[0];
        for (String word : front.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!word.isEmpty() && !SUPERTYPES.contains(word)) {
                return word;
            }
        }
        return "unknown";
    }

    /**
     * Mana value bucket used by histograms: values of 7 or more share bucket 7.
     */
    public int manaValueBucket() {
        return Math.min(7, (int) Math.floor(manaValue));
    }

    public String powerToughness() {
        if (power == null || toughness == null) {
            return null;
        }
        return power + "/" + toughness;
    }

    /**
     * A card without legality data is treated as legal everywhere.
     */
    public boolean isLegalIn(String format) {
        if (legalities == null || legalities.isEmpty() || format == null) {
            return true;
        }
        String status = legalities.get(format.toLowerCase(Locale.ROOT));
        return status == null || "legal".equalsIgnoreCase(status) || "restricted".equalsIgnoreCase(status);
    }

    /**
     * True only when the legality map explicitly lists the card as legal in the format.
     */
    public boolean isExplicitlyLegalIn(String format) {
        if (legalities == null || format == null) {
            return false;
        }
        return "legal".equalsIgnoreCase(legalities.get(format.toLowerCase(Locale.ROOT)));
    }
}
