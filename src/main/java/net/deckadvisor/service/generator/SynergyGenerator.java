package net.deckadvisor.service.generator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.CatalogQuery;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.GeneratorKind;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.model.SynergyTheme;
import net.deckadvisor.service.KeywordExtractor;
import net.deckadvisor.service.SynergyThemes;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Suggests more cards for the deck's strongest tribal or mechanical themes.
 */
@Component
@Slf4j
public class SynergyGenerator extends AbstractCandidateGenerator {

    private final List<SynergyTheme> themes;

    @Autowired
    public SynergyGenerator(CatalogClient catalogClient,
                            KeywordExtractor keywordExtractor,
                            RecommendationProperties properties) {
        this(catalogClient, keywordExtractor, properties, SynergyThemes.defaults());
    }

    public SynergyGenerator(CatalogClient catalogClient,
                            KeywordExtractor keywordExtractor,
                            RecommendationProperties properties,
                            List<SynergyTheme> themes) {
        super(catalogClient, keywordExtractor, properties);
        this.themes = List.copyOf(themes);
    }

    @Override
    public GeneratorKind kind() {
        return GeneratorKind.SYNERGY;
    }

    /**
     * A detected theme and its weighted occurrence count.
     */
    record ThemeStrength(SynergyTheme theme, int strength) {
    }

    /**
     * Themes over their threshold, strongest first, ties in definition order.
     */
    List<ThemeStrength> detectThemes(GenerationContext context) {
        RecommendationProperties.Synergy settings = properties.getSynergy();
        List<ThemeStrength> detected = new ArrayList<>();
        for (SynergyTheme theme : themes) {
            int strength = context.profile().themes().getOrDefault(theme.name(), 0);
            int threshold = theme.kind() == SynergyTheme.Kind.TRIBAL
                ? settings.getTribalThreshold()
                : settings.getMechanicThreshold();
            if (strength >= threshold) {
                detected.add(new ThemeStrength(theme, strength));
            }
        }
        detected.sort(Comparator.comparingInt(ThemeStrength::strength).reversed());
        return detected.subList(0, Math.min(settings.getMaxThemes(), detected.size()));
    }

    @Override
    protected List<Recommendation> doGenerate(GenerationContext context) {
        List<ThemeStrength> detected = detectThemes(context);
        if (detected.isEmpty()) {
            return List.of();
        }
        RecommendationProperties.Synergy settings = properties.getSynergy();
        int limit = scaledLimit(settings.getLimit(), context);
        int perTheme = (int) Math.ceil((double) limit / detected.size());
        Set<String> seen = new HashSet<>();

        List<Recommendation> recommendations = new ArrayList<>();
        for (ThemeStrength themeStrength : detected) {
            SynergyTheme theme = themeStrength.theme();
            double normalized = Math.min(1d, themeStrength.strength() / settings.getStrengthScale());
            int added = 0;
            for (Card card : findCandidates(themeQuery(theme, context), perTheme, context, seen)) {
                if (added >= perTheme || recommendations.size() >= limit) {
                    break;
                }
                recommendations.add(recommendationFor(card)
                    .confidence(settings.getBaseConfidence() + normalized * settings.getStrengthWeight())
                    .synergyScore(normalized)
                    .metaScore(settings.getMetaScore())
                    .deckFitScore(settings.getDeckFitScore())
                    .reasons(List.of(
                        "Supports your " + theme.name() + " theme (" + themeStrength.strength() + " cards)",
                        theme.kind() == SynergyTheme.Kind.TRIBAL ? "Tribal synergy" : "Mechanical synergy"))
                    .build());
                added++;
            }
        }
        log.debug("Synergy produced {} candidates for themes {}", recommendations.size(),
            detected.stream().map(t -> t.theme().name()).toList());
        return recommendations;
    }

    private CatalogQuery themeQuery(SynergyTheme theme, GenerationContext context) {
        CatalogQuery.CatalogQueryBuilder query = baseQuery(context);
        if (theme.kind() == SynergyTheme.Kind.TRIBAL) {
            String tribe = theme.terms().get(0);
            return query.typeTerms(List.of(tribe)).oracleTerms(List.of(tribe)).build();
        }
        return query.oracleTerms(theme.terms().subList(0, Math.min(2, theme.terms().size()))).build();
    }
}
