package net.deckadvisor.service.generator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.catalog.CatalogClient;
import net.deckadvisor.catalog.CatalogQuery;
import net.deckadvisor.config.RecommendationProperties;
import net.deckadvisor.model.Card;
import net.deckadvisor.model.DeckProfile;
import net.deckadvisor.model.GeneratorKind;
import net.deckadvisor.model.Rarity;
import net.deckadvisor.model.Recommendation;
import net.deckadvisor.service.KeywordExtractor;
import net.deckadvisor.util.ScoreUtils;
import org.springframework.stereotype.Component;

/**
 * Fills mana value slots where the deck falls short of the ideal curve.
 *
 * <p>Shares are computed over the whole mainboard, lands included. A slot is a gap when its share is below
 * {@code gapThreshold} of the ideal share; the largest gaps are filled first.
 * Mythics are excluded to keep suggestions craftable.</p>
 */
@Component
@Slf4j
public class CurveGapGenerator extends AbstractCandidateGenerator {

    public CurveGapGenerator(CatalogClient catalogClient,
                             KeywordExtractor keywordExtractor,
                             RecommendationProperties properties) {
        super(catalogClient, keywordExtractor, properties);
    }

    @Override
    public GeneratorKind kind() {
        return GeneratorKind.CURVE_GAP;
    }

    /**
     * A mana value slot below its ideal share.
     *
     * @param manaValue the slot
     * @param actualShare share of mainboard cards in the slot
     * @param idealShare target share
     */
    record CurveGap(int manaValue, double actualShare, double idealShare) {
        double size() {
            return idealShare - actualShare;
        }
    }

    /**
     * Gaps largest first, ties by lower mana value, capped at {@code maxGaps}.
     */
    List<CurveGap> findGaps(DeckProfile profile) {
        RecommendationProperties.CurveGap settings = properties.getCurveGap();
        int total = profile.totalCards();
        List<CurveGap> gaps = new ArrayList<>();
        for (Map.Entry<Integer, Double> ideal : settings.getIdealDistribution().entrySet()) {
            int manaValue = ideal.getKey();
            double actual = ScoreUtils.ratio(profile.manaValueCount(manaValue), total);
            if (actual < ideal.getValue() * settings.getGapThreshold()) {
                gaps.add(new CurveGap(manaValue, actual, ideal.getValue()));
            }
        }
        gaps.sort(Comparator.comparingDouble(CurveGap::size).reversed()
            .thenComparingInt(CurveGap::manaValue));
        return gaps.subList(0, Math.min(settings.getMaxGaps(), gaps.size()));
    }

    @Override
    protected List<Recommendation> doGenerate(GenerationContext context) {
        List<CurveGap> gaps = findGaps(context.profile());
        if (gaps.isEmpty()) {
            return List.of();
        }
        RecommendationProperties.CurveGap settings = properties.getCurveGap();
        int limit = scaledLimit(settings.getLimit(), context);
        int perGap = (int) Math.ceil((double) limit / gaps.size());
        Set<String> seen = new HashSet<>();

        List<Recommendation> recommendations = new ArrayList<>();
        for (CurveGap gap : gaps) {
            CatalogQuery query = baseQuery(context)
                .minManaValue((double) gap.manaValue())
                .maxManaValue((double) gap.manaValue())
                .rarities(EnumSet.of(Rarity.COMMON, Rarity.UNCOMMON, Rarity.RARE))
                .build();
            int added = 0;
            for (Card card : findCandidates(query, perGap, context, seen)) {
                if (added >= perGap || recommendations.size() >= limit) {
                    break;
                }
                recommendations.add(recommendationFor(card)
                    .confidence(Math.min(1d, settings.getBaseConfidence() + gap.size()))
                    .synergyScore(settings.getSynergyScore())
                    .metaScore(settings.getMetaScore())
                    .deckFitScore(settings.getDeckFitScore())
                    .reasons(List.of(
                        "Fills a gap at mana value " + gap.manaValue(),
                        String.format(Locale.ROOT, "Deck has %.0f%% of its cards there, ideal is %.0f%%",
                            gap.actualShare() * 100, gap.idealShare() * 100)))
                    .build());
                added++;
            }
        }
        log.debug("Curve gap produced {} candidates for slots {}", recommendations.size(),
            gaps.stream().map(CurveGap::manaValue).toList());
        return recommendations;
    }
}
