package net.deckadvisor.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Printing rarity, lowest first.
 */
public enum Rarity {
    COMMON("common"),
    UNCOMMON("uncommon"),
    RARE("rare"),
    MYTHIC("mythic");

    private final String value;

    Rarity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Accepts catalog spellings ({@code "mythic"}, {@code "Mythic Rare"}) and single-letter codes.
     */
    public static Optional<Rarity> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "c":
            case "common":
                return Optional.of(COMMON);
            case "u":
            case "uncommon":
                return Optional.of(UNCOMMON);
            case "r":
            case "rare":
                return Optional.of(RARE);
            case "m":
            case "mythic":
            case "mythic rare":
                return Optional.of(MYTHIC);
            default:
                return Optional.empty();
        }
    }
}
