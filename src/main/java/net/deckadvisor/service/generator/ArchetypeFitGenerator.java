package net.deckadvisor.service.generator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.CatalogQuery;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.ArchetypeTemplate;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.GeneratorKind;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.KeywordExtractor;
import org.springframework.stereotype.Component;

/**
 * Suggests cards that carry the winning archetype's keywords within its mana value range.
 *
 * <p>Fit is {@code min(0.4, keywordMatches * 0.1)}, plus 0.3 inside the mana value range, plus 0.2
 * when a one-sided creature ratio bound prefers the card's kind. A two-sided range adds nothing.</p>
 */
@Component
@Slf4j
public class ArchetypeFitGenerator extends AbstractCandidateGenerator {

    public ArchetypeFitGenerator(CatalogClient catalogClient,
                                 KeywordExtractor keywordExtractor,
                                 RecommendationProperties properties) {
        super(catalogClient, keywordExtractor, properties);
    }

    @Override
    public GeneratorKind kind() {
        return GeneratorKind.ARCHETYPE_FIT;
    }

    @Override
    protected List<Recommendation> doGenerate(GenerationContext context) {
        ArchetypeTemplate template = context.template();
        if (template == null) {
            return List.of();
        }
        RecommendationProperties.ArchetypeFit settings = properties.getArchetypeFit();
        int limit = scaledLimit(settings.getLimit(), context);
        List<String> queryTerms = template.keywords().subList(0,
            Math.min(settings.getQueryKeywords(), template.keywords().size()));
        CatalogQuery.CatalogQueryBuilder query = baseQuery(context).oracleTerms(queryTerms);
        if (template.manaValueRange() != null) {
            query.minManaValue((double) template.manaValueRange().min())
                .maxManaValue((double) template.manaValueRange().max());
        }

        List<Recommendation> recommendations = new ArrayList<>();
        for (Card card : findCandidates(query.build(), limit, context, new HashSet<>())) {
            if (recommendations.size() >= limit) {
                break;
            }
            List<String> matched = template.keywords().stream()
                .filter(keyword -> keywordExtractor.matchesAny(card.oracleText(), List.of(keyword)))
                .toList();
            double fit = fitScore(template, card, matched.size(), settings);
            if (fit < settings.getMinFit()) {
                continue;
            }
            List<String> reasons = new ArrayList<>();
            reasons.add("Fits your " + template.name() + " strategy");
            if (!matched.isEmpty()) {
                reasons.add("Has " + String.join(", ", matched));
            }
            if (template.manaValueRange() != null && template.manaValueRange().contains(card.manaValue())) {
                reasons.add("Mana value " + formatManaValue(card.manaValue()) + " suits the "
                    + template.manaValueRange().min() + "-" + template.manaValueRange().max() + " curve");
            }
            recommendations.add(recommendationFor(card)
                .confidence(settings.getBaseConfidence() + fit * settings.getFitWeight())
                .synergyScore(fit)
                .metaScore(settings.getMetaScore())
                .deckFitScore(settings.getDeckFitScore())
                .reasons(reasons)
                .build());
        }
        log.debug("Archetype fit produced {} candidates for {}", recommendations.size(), template.name());
        return recommendations;
    }

    double fitScore(ArchetypeTemplate template, Card card, int keywordMatches,
                    RecommendationProperties.ArchetypeFit settings) {
        double fit = Math.min(settings.getKeywordCap(), keywordMatches * settings.getKeywordMatchWeight());
        if (template.manaValueRange() != null && template.manaValueRange().contains(card.manaValue())) {
            fit += settings.getRangeBonus();
        }
        if (template.creatureRatioBound() != null) {
            boolean preferred = template.creatureRatioBound().prefersCreatures()
                .map(wantsCreature -> wantsCreature == card.isCreature())
                .orElse(false);
            if (preferred) {
                fit += settings.getCreatureBonus();
            }
        }
        return Math.min(1d, fit);
    }
}
