package net.deckadvisor.service.generator;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.ArchetypeTemplate;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.util.ManaColors;

/**
 * Inputs shared by every candidate generator for one recommendation pass.
 *
 * @param profile analyzed deck
 * @param classification archetype label and scores
 * @param template template of the winning archetype, null when the label has no template
 * @param deckNames lower-cased mainboard names, never recommended
 * @param deckColors deck colours in WUBRG order
 * @param format target format
 * @param targetCount how many recommendations the caller wants in total
 */
public record GenerationContext(
    DeckProfile profile,
    ArchetypeClassification classification,
    ArchetypeTemplate template,
    Set<String> deckNames,
    List<String> deckColors,
    String format,
    int targetCount
) {
    public GenerationContext {
        deckNames = deckNames == null ? Set.of() : Set.copyOf(deckNames);
        deckColors = ManaColors.normalize(deckColors);
        format = format == null ? null : format.toLowerCase(Locale.ROOT);
    }

    public boolean isInDeck(String cardName) {
        return cardName != null && deckNames.contains(cardName.toLowerCase(Locale.ROOT));
    }

    public String archetype() {
        return classification == null ? null : classification.archetype();
    }
}
