package net.deckadvisor.service.generator;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.CatalogQuery;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.GeneratorKind;
import net.deckadvisor.model.Rarity;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.KeywordExtractor;
import org.springframework.stereotype.Component;

/**
 * Suggests popular format-legal cards in the deck's colours, favouring higher rarities
 * as a proxy for competitive relevance.
 */
@Component
@Slf4j
public class FormatStaplesGenerator extends AbstractCandidateGenerator {

    public FormatStaplesGenerator(CatalogClient catalogClient,
                                  KeywordExtractor keywordExtractor,
                                  RecommendationProperties properties) {
        super(catalogClient, keywordExtractor, properties);
    }

    @Override
    public GeneratorKind kind() {
        return GeneratorKind.FORMAT_STAPLES;
    }

    @Override
    protected List<Recommendation> doGenerate(GenerationContext context) {
        RecommendationProperties.Staples settings = properties.getStaples();
        int limit = scaledLimit(settings.getLimit(), context);
        CatalogQuery query = baseQuery(context)
            .maxManaValue((double) settings.getMaxManaValue())
            .rarities(EnumSet.of(Rarity.UNCOMMON, Rarity.RARE, Rarity.MYTHIC))
            .build();

        List<Recommendation> recommendations = new ArrayList<>();
        for (Card card : findCandidates(query, limit, context, new HashSet<>())) {
            if (recommendations.size() >= limit) {
                break;
            }
            boolean legal = card.isExplicitlyLegalIn(context.format());
            Optional<Rarity> rarity = Rarity.parse(card.rarity());
            double confidence = settings.getBaseConfidence()
                + (legal ? settings.getLegalBonus() : 0d)
                + rarityBonus(rarity, settings);
            confidence = Math.min(1d, confidence);
            if (confidence < settings.getMinConfidence()) {
                continue;
            }
            List<String> reasons = new ArrayList<>();
            reasons.add("Popular " + context.format() + " staple");
            if (legal) {
                reasons.add("Legal in " + context.format());
            }
            rarity.filter(r -> r.compareTo(Rarity.UNCOMMON) >= 0)
                .ifPresent(r -> reasons.add("High-impact " + r.getValue() + " card"));
            recommendations.add(recommendationFor(card)
                .confidence(confidence)
                .synergyScore(settings.getSynergyScore())
                .metaScore(settings.getMetaScore())
                .deckFitScore(settings.getDeckFitScore())
                .reasons(reasons)
                .build());
        }
        log.debug("Format staples produced {} candidates for {}", recommendations.size(), context.format());
        return recommendations;
    }

    private static double rarityBonus(Optional<Rarity> rarity, RecommendationProperties.Staples settings) {
        if (rarity.isEmpty()) {
            return 0d;
        }
        return switch (rarity.get()) {
            case RARE, MYTHIC -> settings.getRareBonus();
            case UNCOMMON -> settings.getUncommonBonus();
            case COMMON -> 0d;
        };
    }
}
