package net.deckadvisor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.deckadvisor.util.ManaColors;
import net.deckadvisor.util.ScoreUtils;

/**
 * Aggregate statistics of a deck's mainboard. Derived on demand and never persisted.
 *
 * <p>The mana value and type histograms each sum to {@code totalCards}. The colour histogram
 * counts a multicoloured card once per colour; keywords and themes are weighted by quantity.</p>
 *
 * @param colors colour symbol to weighted count
 * @param manaValues mana value bucket (0..7, 7 meaning 7 or more) to count
 * @param types primary type to count
 * @param keywords keyword tag to weighted count
 * @param themes synergy theme name to weighted occurrences
 * @param totalCards total mainboard quantity
 */
public record DeckProfile(
    Map<String, Integer> colors,
    Map<Integer, Integer> manaValues,
    Map<String, Integer> types,
    Map<String, Integer> keywords,
    Map<String, Integer> themes,
    int totalCards
) {
    public DeckProfile {
        colors = freeze(colors);
        manaValues = manaValues == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(manaValues));
        types = freeze(types);
        keywords = freeze(keywords);
        themes = freeze(themes);
        totalCards = Math.max(0, totalCards);
    }

    public static DeckProfile empty() {
        return new DeckProfile(Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), 0);
    }

    public boolean isEmpty() {
        return totalCards == 0;
    }

    public int typeCount(String type) {
        return types.getOrDefault(type, 0);
    }

    public int keywordCount(String tag) {
        return keywords.getOrDefault(tag, 0);
    }

    public int manaValueCount(int bucket) {
        return manaValues.getOrDefault(bucket, 0);
    }

    public double creatureRatio() {
        return ScoreUtils.ratio(typeCount("creature"), totalCards);
    }

    public int landCount() {
        return typeCount("land");
    }

    public int spellCount() {
        return totalCards - landCount();
    }

    /**
     * Colours present in the deck, in WUBRG order.
     */
    public List<String> colorIdentity() {
        return ManaColors.normalize(colors.entrySet().stream()
            .filter(entry -> entry.getValue() > 0)
            .map(Map.Entry::getKey)
            .toList());
    }

    private static <K> Map<K, Integer> freeze(Map<K, Integer> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
