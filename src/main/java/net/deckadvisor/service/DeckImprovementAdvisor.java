package net.deckadvisor.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.ArchetypeClassification;
import net.deckadvisor.model.DeckImprovement;
import net.deckadvisor.model.DeckProfile;
import org.springframework.stereotype.Component;

/**
 * General deck-building advice derived from a profile and its classification: deck size,
 * curve balance, colour count and strategic focus.
 */
@Component
@Slf4j
public class DeckImprovementAdvisor {

    private final RecommendationProperties.Improvements settings;

    public DeckImprovementAdvisor(RecommendationProperties properties) {
        this.settings = properties.getImprovements();
    }

    public List<DeckImprovement> suggest(DeckProfile profile, ArchetypeClassification classification) {
        List<DeckImprovement> improvements = new ArrayList<>();
        int total = profile.totalCards();

        if (total < settings.getMinDeckSize()) {
            improvements.add(new DeckImprovement(DeckImprovement.Kind.DECK_SIZE,
                "Consider adding " + (settings.getMinDeckSize() - total) + " more cards to reach minimum deck size"));
        }

        int earlyGame = countManaValues(profile, 0, settings.getEarlyGameMaxManaValue());
        if (earlyGame < total * settings.getMinEarlyGameShare()) {
            improvements.add(new DeckImprovement(DeckImprovement.Kind.EARLY_GAME,
                "Consider adding more low-cost cards for early game"));
        }

        int lateGame = countManaValues(profile, settings.getLateGameMinManaValue(), Integer.MAX_VALUE);
        if (lateGame > total * settings.getMaxLateGameShare()) {
            improvements.add(new DeckImprovement(DeckImprovement.Kind.LATE_GAME,
                "Consider reducing high-cost cards to improve consistency"));
        }

        if (profile.colorIdentity().size() > settings.getMaxColors()) {
            improvements.add(new DeckImprovement(DeckImprovement.Kind.TOO_MANY_COLORS,
                "Consider focusing on fewer colors for better mana consistency"));
        }

        if (classification != null && !classification.scores().isEmpty()) {
            double best = classification.scores().values().stream().mapToDouble(Double::doubleValue).max().orElse(0d);
            if (best < settings.getFocusThreshold()) {
                improvements.add(new DeckImprovement(DeckImprovement.Kind.UNFOCUSED,
                    "Deck seems unfocused - consider committing more to a specific strategy"));
            }
        }

        log.debug("Deck improvement check produced {}", improvements.stream().map(DeckImprovement::kind).toList());
        return List.copyOf(improvements);
    }

    private static int countManaValues(DeckProfile profile, int from, int to) {
        return profile.manaValues().entrySet().stream()
            .filter(entry -> entry.getKey() >= from && entry.getKey() <= to)
            .mapToInt(Map.Entry::getValue)
            .sum();
    }
}
