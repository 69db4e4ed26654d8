package net.deckadvisor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a recommended card is already owned or, if not, at which rarity it must be acquired.
 */
public enum OwnershipStatus {
    OWNED("owned"),
    CRAFT_COMMON("craft-common"),
    CRAFT_UNCOMMON("craft-uncommon"),
    CRAFT_RARE("craft-rare"),
    CRAFT_MYTHIC("craft-mythic"),
    UNKNOWN("unknown");

    private final String value;

    OwnershipStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Craft status for a rarity string; unrecognized rarities map to {@link #UNKNOWN}.
     */
    public static OwnershipStatus craftFor(String rarity) {
        return Rarity.parse(rarity)
            .map(parsed -> switch (parsed) {
                case COMMON -> CRAFT_COMMON;
                case UNCOMMON -> CRAFT_UNCOMMON;
                case RARE -> CRAFT_RARE;
                case MYTHIC -> CRAFT_MYTHIC;
            })
            .orElse(UNKNOWN);
    }
}
