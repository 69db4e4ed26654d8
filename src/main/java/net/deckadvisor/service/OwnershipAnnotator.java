package net.deckadvisor.service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.CardCollection;
import net.deckadvisor.model.CollectionEntry;
import net.deckadvisor.model.OwnershipStatus;
import net.deckadvisor.model.Recommendation;
import org.springframework.stereotype.Component;

/**
 * Marks each recommendation as owned or as a craft at its rarity. Owned cards gain a confidence
 * bonus, clamped to 1. List order is preserved and the collection is only read.
 */
@Component
public class OwnershipAnnotator {

    private final double ownedBonus;

    public OwnershipAnnotator(RecommendationProperties properties) {
        this.ownedBonus = properties.getOwnedBonus();
    }

    public List<Recommendation> annotate(List<Recommendation> recommendations, CardCollection collection) {
        if (collection == null) {
            return recommendations.stream()
                .map(recommendation -> recommendation.withOwnership(OwnershipStatus.UNKNOWN))
                .toList();
        }
        return recommendations.stream()
            .map(recommendation -> annotate(recommendation, collection))
            .toList();
    }

    Recommendation annotate(Recommendation recommendation, CardCollection collection) {
        Optional<CollectionEntry> owned = collection.find(recommendation.name())
            .filter(entry -> entry.total() > 0);
        if (owned.isPresent()) {
            return recommendation.toBuilder()
                .ownership(OwnershipStatus.OWNED)
                .confidence(recommendation.confidence() + ownedBonus)
                .reasons(withReason(recommendation.reasons(), "Already in your collection (" + owned.get().total() + ")"))
                .build();
        }
        return recommendation.withOwnership(OwnershipStatus.craftFor(recommendation.rarity()));
    }

    private static List<String> withReason(List<String> reasons, String reason) {
        return Stream.concat(reasons.stream(), Stream.of(reason)).toList();
    }
}
