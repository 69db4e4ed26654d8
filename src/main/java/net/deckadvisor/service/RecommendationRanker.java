package net.deckadvisor.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.deckadvisor.model.GeneratorKind;
import net.deckadvisor.model.Recommendation;
import org.springframework.stereotype.Component;

/**
 * Merges generator output into one ranked list.
 *
 * <p>Duplicates (case-insensitive name) keep the occurrence from the earliest generator in
 * {@link GeneratorKind} order. The result is stably sorted by confidence, then synergy, both descending.</p>
 */
@Component
public class RecommendationRanker {

    static final Comparator<Recommendation> RANKING = Comparator
        .comparingDouble(Recommendation::confidence).reversed()
        .thenComparing(Comparator.comparingDouble(Recommendation::synergyScore).reversed());

    public List<Recommendation> rank(Map<GeneratorKind, List<Recommendation>> candidates) {
        Map<String, Recommendation> unique = new LinkedHashMap<>();
        for (GeneratorKind kind : GeneratorKind.values()) {
            List<Recommendation> fromGenerator = candidates.get(kind);
            if (fromGenerator == null) {
                continue;
            }
            for (Recommendation recommendation : fromGenerator) {
                unique.putIfAbsent(recommendation.name().toLowerCase(Locale.ROOT), recommendation);
            }
        }
        List<Recommendation> ranked = new ArrayList<>(unique.values());
        ranked.sort(RANKING);
        return ranked;
    }
}
