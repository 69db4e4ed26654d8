package net.deckadvisor.service;

import java.util.List;
import net.deckadvisor.model.SynergyTheme;

/**
 * The built-in synergy themes, tribal first. List order breaks ties between equally strong themes.
 */
public final class SynergyThemes {

    private static final List<SynergyTheme> DEFAULTS = List.of(
        SynergyTheme.tribal("elf", "elf", "elves", "elvish"),
        SynergyTheme.tribal("goblin", "goblin"),
        SynergyTheme.tribal("vampire", "vampire"),
        SynergyTheme.tribal("angel", "angel"),
        SynergyTheme.tribal("dragon", "dragon"),
        SynergyTheme.mechanic("artifacts", "artifact", "metalcraft", "affinity", "improvise"),
        SynergyTheme.mechanic("graveyard", "graveyard", "flashback", "dredge", "delve", "escape"),
        SynergyTheme.mechanic("spells matter", "instant or sorcery", "prowess", "storm", "magecraft"),
        SynergyTheme.mechanic("sacrifice", "sacrifice", "dies"),
        SynergyTheme.mechanic("lifegain", "gain life", "gains life", "lifelink")
    );

    private SynergyThemes() {
    }

    public static List<SynergyTheme> defaults() {
        return DEFAULTS;
    }
}
