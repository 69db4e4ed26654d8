package net.deckadvisor.support;

import java.util.List;
import java.util.Map;
import net.deckadvisor.model.Card;

/**
 * Card fixtures shared across tests.
 */
public final class TestCards {

    public static final Map<String, String> STANDARD_LEGAL = Map.of("standard", "legal", "modern", "legal");
    public static final Map<String, String> MODERN_ONLY = Map.of("standard", "not_legal", "modern", "legal");

    private TestCards() {
    }

    public static Card bolt(String name) {
        return Card.builder()
            .name(name)
            .manaCost("{R}")
            .manaValue(1)
            .typeLine("Instant")
            .colors(List.of("R"))
            .rarity("common")
            .oracleText(name + " deals 3 damage to any target.")
            .legalities(STANDARD_LEGAL)
            .build();
    }

    public static Card creature(String name, String colors, double manaValue, String rarity, String oracleText) {
        return Card.builder()
            .name(name)
            .manaCost("{" + (int) manaValue + "}")
            .manaValue(manaValue)
            .typeLine("Creature — Human Warrior")
            .colors(colors.isEmpty() ? List.of() : List.of(colors.split("")))
            .rarity(rarity)
            .oracleText(oracleText)
            .power("2")
            .toughness("2")
            .legalities(STANDARD_LEGAL)
            .build();
    }

    public static Card spell(String name, String colors, double manaValue, String rarity, String oracleText) {
        return Card.builder()
            .name(name)
            .manaCost("{" + (int) manaValue + "}")
            .manaValue(manaValue)
            .typeLine("Sorcery")
            .colors(colors.isEmpty() ? List.of() : List.of(colors.split("")))
            .rarity(rarity)
            .oracleText(oracleText)
            .legalities(STANDARD_LEGAL)
            .build();
    }

    public static Card elf(String name, double manaValue) {
        return Card.builder()
            .name(name)
            .manaCost("{G}")
            .manaValue(manaValue)
            .typeLine("Creature — Elf Druid")
            .colors(List.of("G"))
            .rarity("common")
            .oracleText("{T}: Add {G}.")
            .power("1")
            .toughness("1")
            .legalities(STANDARD_LEGAL)
            .build();
    }

    public static Card basicLand(String name, String color) {
        return Card.builder()
            .name(name)
            .typeLine("Basic Land — " + name)
            .rarity("common")
            .oracleText("({T}: Add {" + color + "}.)")
            .legalities(STANDARD_LEGAL)
            .build();
    }
}
